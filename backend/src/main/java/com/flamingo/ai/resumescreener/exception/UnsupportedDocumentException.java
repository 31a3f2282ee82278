package com.flamingo.ai.resumescreener.exception;

import java.util.List;

/** Exception thrown when none of the uploaded files can be decoded to text. */
public class UnsupportedDocumentException extends RuntimeException {

  private final List<String> fileNames;

  public UnsupportedDocumentException(List<String> fileNames) {
    super("No supported documents uploaded: " + fileNames);
    this.fileNames = fileNames.stream().map(String::valueOf).toList();
  }

  public List<String> getFileNames() {
    return fileNames;
  }
}
