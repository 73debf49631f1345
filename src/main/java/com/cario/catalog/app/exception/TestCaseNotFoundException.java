package com.cario.catalog.app.exception;

/** Thrown when a validation is requested for an unknown test case id. */
public class TestCaseNotFoundException extends RuntimeException {

  public TestCaseNotFoundException(String testCaseId) {
    super("Test case not found: " + testCaseId);
  }
}
