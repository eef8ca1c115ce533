package com.autoapply.tool.easyapply.wizard;

import java.nio.charset.StandardCharsets;
import java.util.Set;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;
import com.autoapply.tool.easyapply.browser.UiElement;

/**
 * Digest of a form step's rendered content. Generated ids and scripts are dropped so the same
 * step re-rendered yields the same digest.
 */
@Component
public class StepFingerprinter {

  private static final Set<String> KEPT_ATTRIBUTES =
      Set.of("name", "type", "role", "aria-label", "value", "placeholder");

  public String fingerprint(UiElement modal) {
    return digest(modal.innerHtml());
  }

  String digest(String html) {
    Document document = Jsoup.parseBodyFragment(html == null ? "" : html);
    document.select("script, style, noscript").remove();
    for (Element element : document.body().getAllElements()) {
      for (Attribute attribute : element.attributes().asList()) {
        if (!KEPT_ATTRIBUTES.contains(attribute.getKey())) {
          element.removeAttr(attribute.getKey());
        }
      }
    }
    String normalized = document.body().html().replaceAll("\\s+", " ").trim();
    return DigestUtils.md5DigestAsHex(normalized.getBytes(StandardCharsets.UTF_8));
  }
}
