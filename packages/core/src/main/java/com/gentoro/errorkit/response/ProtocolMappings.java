package com.gentoro.errorkit.response;

import static com.gentoro.errorkit.exception.AppErrorKind.*;

import com.gentoro.errorkit.exception.AppCode;
import com.gentoro.errorkit.exception.AppError;
import com.gentoro.errorkit.exception.AppErrorKind;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Constant table from {@link AppCode} to HTTP status, gRPC status and problem type.
 *
 * <p>Every built-in code is registered. Codes defined by applications resolve through the
 * canonical code of their kind.
 */
public final class ProtocolMappings {
  private static final Map<AppCode, CodeMapping> TABLE =
      Stream.of(
              entry(AppCode.NOT_FOUND, NOT_FOUND, 404, GrpcCode.NOT_FOUND),
              entry(AppCode.VALIDATION, VALIDATION, 422, GrpcCode.INVALID_ARGUMENT),
              entry(AppCode.CONFLICT, CONFLICT, 409, GrpcCode.ALREADY_EXISTS),
              entry(AppCode.USER_ALREADY_EXISTS, CONFLICT, 409, GrpcCode.ALREADY_EXISTS),
              entry(AppCode.UNAUTHORIZED, UNAUTHORIZED, 401, GrpcCode.UNAUTHENTICATED),
              entry(AppCode.FORBIDDEN, FORBIDDEN, 403, GrpcCode.PERMISSION_DENIED),
              entry(AppCode.NOT_IMPLEMENTED, NOT_IMPLEMENTED, 501, GrpcCode.UNIMPLEMENTED),
              entry(AppCode.BAD_REQUEST, BAD_REQUEST, 400, GrpcCode.INVALID_ARGUMENT),
              entry(AppCode.RATE_LIMITED, RATE_LIMITED, 429, GrpcCode.RESOURCE_EXHAUSTED),
              entry(AppCode.TELEGRAM_AUTH, TELEGRAM_AUTH, 401, GrpcCode.UNAUTHENTICATED),
              entry(AppCode.INVALID_JWT, INVALID_JWT, 401, GrpcCode.UNAUTHENTICATED),
              entry(AppCode.INTERNAL, INTERNAL, 500, GrpcCode.INTERNAL),
              entry(AppCode.DATABASE, DATABASE, 500, GrpcCode.INTERNAL),
              entry(AppCode.SERVICE, SERVICE, 500, GrpcCode.INTERNAL),
              entry(AppCode.CONFIG, CONFIG, 500, GrpcCode.INTERNAL),
              entry(AppCode.TURNKEY, TURNKEY, 500, GrpcCode.INTERNAL),
              entry(AppCode.TIMEOUT, TIMEOUT, 504, GrpcCode.DEADLINE_EXCEEDED),
              entry(AppCode.NETWORK, NETWORK, 503, GrpcCode.UNAVAILABLE),
              entry(
                  AppCode.DEPENDENCY_UNAVAILABLE,
                  DEPENDENCY_UNAVAILABLE,
                  503,
                  GrpcCode.UNAVAILABLE),
              entry(AppCode.SERIALIZATION, SERIALIZATION, 500, GrpcCode.INTERNAL),
              entry(AppCode.DESERIALIZATION, DESERIALIZATION, 500, GrpcCode.INTERNAL),
              entry(AppCode.EXTERNAL_API, EXTERNAL_API, 500, GrpcCode.UNAVAILABLE),
              entry(AppCode.QUEUE, QUEUE, 500, GrpcCode.UNAVAILABLE),
              entry(AppCode.CACHE, CACHE, 500, GrpcCode.UNAVAILABLE))
          .collect(Collectors.toUnmodifiableMap(CodeMapping::code, Function.identity()));

  private ProtocolMappings() {}

  private static CodeMapping entry(AppCode code, AppErrorKind kind, int http, GrpcCode grpc) {
    return new CodeMapping(code, kind, http, grpc);
  }

  /**
   * Mapping of a registered code.
   *
   * @throws IllegalStateException if {@code code} is not registered
   */
  public static CodeMapping mappingFor(AppCode code) {
    CodeMapping mapping = TABLE.get(Objects.requireNonNull(code, "code"));
    if (mapping == null) {
      throw new IllegalStateException("No protocol mapping registered for " + code);
    }
    return mapping;
  }

  /** Mapping of {@code code}, or of the canonical code of {@code kind} for unregistered codes. */
  public static CodeMapping mappingFor(AppCode code, AppErrorKind kind) {
    CodeMapping mapping = TABLE.get(code);
    return mapping != null ? mapping : mappingFor(AppCode.forKind(kind));
  }

  public static CodeMapping mappingFor(AppError error) {
    return mappingFor(error.getCode(), error.getKind());
  }

  public static boolean isRegistered(AppCode code) {
    return TABLE.containsKey(code);
  }

  public static GrpcCode grpcFor(AppErrorKind kind) {
    return mappingFor(AppCode.forKind(kind)).grpc();
  }

  public static String problemTypeFor(AppCode code) {
    return mappingFor(code).problemType();
  }

  public static Collection<CodeMapping> all() {
    return TABLE.values();
  }
}
