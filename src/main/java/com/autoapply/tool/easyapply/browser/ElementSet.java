package com.autoapply.tool.easyapply.browser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Ordered result of a locate call.
 */
@Slf4j
public final class ElementSet implements Iterable<UiElement> {

  private static final ElementSet EMPTY = new ElementSet(Collections.emptyList());

  private final List<UiElement> elements;

  private ElementSet(List<UiElement> elements) {
    this.elements = elements;
  }

  public static ElementSet of(List<? extends UiElement> elements) {
    if (elements == null || elements.isEmpty()) {
      return EMPTY;
    }
    return new ElementSet(Collections.unmodifiableList(new ArrayList<>(elements)));
  }

  public int count() {
    return elements.size();
  }

  public boolean isEmpty() {
    return elements.isEmpty();
  }

  public UiElement first() {
    return nth(0);
  }

  public UiElement nth(int index) {
    if (index < 0 || index >= elements.size()) {
      throw new UiInteractionException(
          "No element at index " + index + " (found " + elements.size() + ")");
    }
    return elements.get(index);
  }

  public List<UiElement> all() {
    return elements;
  }

  /**
   * Keep only the elements currently rendered; elements that went stale are dropped
   */
  public ElementSet visible() {
    List<UiElement> shown = new ArrayList<>();
    for (UiElement element : elements) {
      try {
        if (element.isVisible()) {
          shown.add(element);
        }
      } catch (UiInteractionException e) {
        log.debug("Dropping element while filtering visibility: {}", e.getMessage());
      }
    }
    return of(shown);
  }

  @Override
  public Iterator<UiElement> iterator() {
    return elements.iterator();
  }
}
