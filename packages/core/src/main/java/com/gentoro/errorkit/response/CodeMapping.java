package com.gentoro.errorkit.response;

import com.gentoro.errorkit.ErrorKit;
import com.gentoro.errorkit.exception.AppCode;
import com.gentoro.errorkit.exception.AppErrorKind;
import java.util.Locale;

/** Transport statuses of one {@link AppCode}. */
public record CodeMapping(AppCode code, AppErrorKind kind, int httpStatus, GrpcCode grpc) {

  /** {@code <base-uri>/<kebab-case code>}, with the base URI from {@link ErrorKit#settings()}. */
  public String problemType() {
    return problemType(ErrorKit.settings().problemBaseUri());
  }

  public String problemType(String baseUri) {
    return baseUri + "/" + slug(code);
  }

  static String slug(AppCode code) {
    return code.value().toLowerCase(Locale.ROOT).replace('_', '-');
  }
}
