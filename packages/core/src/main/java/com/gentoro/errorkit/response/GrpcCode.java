package com.gentoro.errorkit.response;

/** Canonical gRPC status code, by name and numeric value. */
public record GrpcCode(String name, int value) {
  public static final GrpcCode INVALID_ARGUMENT = new GrpcCode("INVALID_ARGUMENT", 3);
  public static final GrpcCode DEADLINE_EXCEEDED = new GrpcCode("DEADLINE_EXCEEDED", 4);
  public static final GrpcCode NOT_FOUND = new GrpcCode("NOT_FOUND", 5);
  public static final GrpcCode ALREADY_EXISTS = new GrpcCode("ALREADY_EXISTS", 6);
  public static final GrpcCode PERMISSION_DENIED = new GrpcCode("PERMISSION_DENIED", 7);
  public static final GrpcCode RESOURCE_EXHAUSTED = new GrpcCode("RESOURCE_EXHAUSTED", 8);
  public static final GrpcCode UNIMPLEMENTED = new GrpcCode("UNIMPLEMENTED", 12);
  public static final GrpcCode INTERNAL = new GrpcCode("INTERNAL", 13);
  public static final GrpcCode UNAVAILABLE = new GrpcCode("UNAVAILABLE", 14);
  public static final GrpcCode UNAUTHENTICATED = new GrpcCode("UNAUTHENTICATED", 16);
}
