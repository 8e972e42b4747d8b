package com.flamingo.ai.quotes.service.ingestion;

/** Why a page produced no stored records. */
public enum SkipReason {
  REDIRECT,
  FORBIDDEN_TITLE,
  NOT_A_PERSON,
  NO_QUOTES
}
