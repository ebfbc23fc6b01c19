package ru.dimension.resolve.handlers;

public class Retry extends FailureHandler {
  public final int attempts;

  public Retry(int attempts) {
    this.attempts = attempts;
  }
}
