package com.flamingo.ai.resumescreener.exception;

/** Exception thrown when a batch upload carries more files than the configured limit. */
public class UploadLimitExceededException extends RuntimeException {

  private final int fileCount;
  private final int maxFiles;

  public UploadLimitExceededException(int fileCount, int maxFiles) {
    super(String.format("Upload of %d files exceeds the limit of %d", fileCount, maxFiles));
    this.fileCount = fileCount;
    this.maxFiles = maxFiles;
  }

  public int getFileCount() {
    return fileCount;
  }

  public int getMaxFiles() {
    return maxFiles;
  }
}
