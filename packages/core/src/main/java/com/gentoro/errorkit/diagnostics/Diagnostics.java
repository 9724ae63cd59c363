package com.gentoro.errorkit.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Hints, suggestions, a documentation link and related codes attached to an error.
 *
 * <p>Hints and suggestions default to {@link Visibility#DEV_ONLY}; the documentation link
 * defaults to {@link Visibility#PUBLIC}. Query methods return lazy views filtered by a minimum
 * visibility.
 */
public final class Diagnostics {
  private final List<Hint> hints = new ArrayList<>(2);
  private final List<Suggestion> suggestions = new ArrayList<>(2);
  private final List<String> relatedCodes = new ArrayList<>(2);
  private DocLink docLink;

  public Diagnostics addHint(String message) {
    return addHint(message, Visibility.DEV_ONLY);
  }

  public Diagnostics addHint(String message, Visibility visibility) {
    hints.add(new Hint(message, visibility));
    return this;
  }

  public Diagnostics addSuggestion(String message) {
    return addSuggestion(message, null, Visibility.DEV_ONLY);
  }

  public Diagnostics addSuggestion(String message, String command) {
    return addSuggestion(message, command, Visibility.DEV_ONLY);
  }

  public Diagnostics addSuggestion(String message, String command, Visibility visibility) {
    suggestions.add(new Suggestion(message, command, visibility));
    return this;
  }

  /** Sets the documentation link, replacing any previous one. */
  public Diagnostics setDocLink(DocLink link) {
    this.docLink = Objects.requireNonNull(link, "link");
    return this;
  }

  public Diagnostics addRelatedCode(String code) {
    relatedCodes.add(Objects.requireNonNull(code, "code"));
    return this;
  }

  public boolean isEmpty() {
    return hints.isEmpty() && suggestions.isEmpty() && docLink == null && relatedCodes.isEmpty();
  }

  public boolean hasVisibleContent(Visibility minimum) {
    return hints.stream().anyMatch(h -> h.visibility().isVisibleAt(minimum))
        || suggestions.stream().anyMatch(s -> s.visibility().isVisibleAt(minimum))
        || (docLink != null && docLink.visibility().isVisibleAt(minimum));
  }

  public Stream<Hint> visibleHints(Visibility minimum) {
    return hints.stream().filter(h -> h.visibility().isVisibleAt(minimum));
  }

  public Stream<Suggestion> visibleSuggestions(Visibility minimum) {
    return suggestions.stream().filter(s -> s.visibility().isVisibleAt(minimum));
  }

  public Optional<DocLink> visibleDocLink(Visibility minimum) {
    return Optional.ofNullable(docLink).filter(d -> d.visibility().isVisibleAt(minimum));
  }

  public List<Hint> hints() {
    return Collections.unmodifiableList(hints);
  }

  public List<Suggestion> suggestions() {
    return Collections.unmodifiableList(suggestions);
  }

  public Optional<DocLink> docLink() {
    return Optional.ofNullable(docLink);
  }

  public List<String> relatedCodes() {
    return Collections.unmodifiableList(relatedCodes);
  }

  /** Independent copy; later changes to either instance do not affect the other. */
  public Diagnostics copy() {
    Diagnostics copy = new Diagnostics();
    copy.hints.addAll(hints);
    copy.suggestions.addAll(suggestions);
    copy.relatedCodes.addAll(relatedCodes);
    copy.docLink = docLink;
    return copy;
  }
}
