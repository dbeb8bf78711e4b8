package com.flamingo.ai.orgassistant.exception;

/** Exception thrown when an ingestion job is requested while another one is still running. */
public class IngestionAlreadyRunningException extends RuntimeException {

  private final String runningJobId;

  public IngestionAlreadyRunningException(String runningJobId) {
    super("Ingestion job " + runningJobId + " is already running");
    this.runningJobId = runningJobId;
  }

  public String getRunningJobId() {
    return runningJobId;
  }
}
