package com.heavyai.client.model.core;

/** Options forwarded with a create-table request. */
public final class CreateOptions {

  public static final CreateOptions DEFAULT = new CreateOptions(false);

  private final boolean replicated;

  public CreateOptions(boolean replicated) {
    this.replicated = replicated;
  }

  public boolean isReplicated() {
    return replicated;
  }
}
