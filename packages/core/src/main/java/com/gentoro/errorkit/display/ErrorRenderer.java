package com.gentoro.errorkit.display;

import com.gentoro.errorkit.exception.AppError;

/** Produces the textual form of an error for one {@link DisplayMode}. */
public interface ErrorRenderer {
  String render(AppError error);
}
