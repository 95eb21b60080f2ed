package com.flamingo.ai.bookqa;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the book question-answering retrieval service. */
@SpringBootApplication
public class BookQaApplication {

  public static void main(String[] args) {
    SpringApplication.run(BookQaApplication.class, args);
  }
}
