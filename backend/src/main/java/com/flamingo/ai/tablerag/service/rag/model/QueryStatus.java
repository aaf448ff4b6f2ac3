package com.flamingo.ai.tablerag.service.rag.model;

/** Outcome category of a query. */
public enum QueryStatus {
  ANSWERED,
  NOT_INGESTED,
  FAILED
}
