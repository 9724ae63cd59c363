package com.gentoro.errorkit.exception;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import org.junit.jupiter.api.Test;

class ExceptionUtilTest {

  @Test
  void causalChainStopsAtDepth() {
    Throwable chain = nest(20);

    assertThat(ExceptionUtil.causalChain(chain, 5)).hasSize(5);
    assertThat(ExceptionUtil.causalChain(chain, 100)).hasSize(20);
    assertThat(ExceptionUtil.causalChain(null, 5)).isEmpty();
  }

  @Test
  void causalChainToleratesCycles() {
    RuntimeException a = new RuntimeException("a");
    RuntimeException b = new RuntimeException("b", a);
    a.initCause(b);

    assertThat(ExceptionUtil.causalChain(b, 10)).containsExactly(b, a);
    assertThat(ExceptionUtil.rootCause(b)).isIn(a, b);
  }

  @Test
  void describeUsesPolicyAwareMessageForAppErrors() {
    AppError secret = AppError.internal("leaked secret").redactable();

    assertThat(ExceptionUtil.describe(secret)).isEqualTo("Internal server error");
    assertThat(ExceptionUtil.describe(new IOException("disk")))
        .isEqualTo("java.io.IOException: disk");
  }

  @Test
  void describeCausesSkipsTheTopLevel() {
    AppError top = AppError.internal("top").withSource(new IOException("below"));

    assertThat(ExceptionUtil.describeCauses(top, 5))
        .containsExactly("java.io.IOException: below");
  }

  @Test
  void asAppErrorKeepsAppErrorsAndConvertsOthers() {
    AppError original = AppError.cache("miss");

    assertThat(ExceptionUtil.asAppError(original, t -> AppError.internal("wrapped")))
        .isSameAs(original);
    assertThat(
            ExceptionUtil.asAppError(
                    new IOException("x"), t -> AppError.internal("wrapped").withSource(t))
                .getKind())
        .isEqualTo(AppErrorKind.INTERNAL);
  }

  static Throwable nest(int depth) {
    Throwable current = new IllegalStateException("level " + (depth - 1));
    for (int i = depth - 2; i >= 0; i--) {
      current = new RuntimeException("level " + i, current);
    }
    return current;
  }
}
