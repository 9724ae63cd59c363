package com.gentoro.errorkit.display;

import com.gentoro.errorkit.ErrorKit;
import com.gentoro.errorkit.ErrorKitSettings;
import com.gentoro.errorkit.utility.ConsoleStyle;

/** Picks the renderer for a {@link DisplayMode}, configured from {@link ErrorKit#settings()}. */
public final class ErrorRenderers {
  private static final ProdRenderer PROD = new ProdRenderer();

  private ErrorRenderers() {}

  public static ErrorRenderer forMode(DisplayMode mode) {
    ErrorKitSettings settings = ErrorKit.settings();
    return switch (mode) {
      case PROD -> PROD;
      case STAGING -> new StagingRenderer(settings.stagingChainDepth());
      case LOCAL -> new LocalRenderer(settings.localChainDepth(), ConsoleStyle.detect());
    };
  }
}
