package com.autoapply.tool.easyapply.session.dto;

import java.util.Date;
import org.openqa.selenium.Cookie;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class StoredCookie {
  private String name;
  private String value;
  private String domain;
  private String path;

  /**
   * Epoch millis, null for session cookies
   */
  private Long expiry;
  private boolean secure;
  private boolean httpOnly;
  private String sameSite;

  public static StoredCookie from(Cookie cookie) {
    return StoredCookie.builder()
        .name(cookie.getName())
        .value(cookie.getValue())
        .domain(cookie.getDomain())
        .path(cookie.getPath())
        .expiry(cookie.getExpiry() != null ? cookie.getExpiry().getTime() : null)
        .secure(cookie.isSecure())
        .httpOnly(cookie.isHttpOnly())
        .sameSite(cookie.getSameSite())
        .build();
  }

  public Cookie toCookie() {
    Cookie.Builder builder = new Cookie.Builder(name, value)
        .path(path != null ? path : "/")
        .isSecure(secure)
        .isHttpOnly(httpOnly);
    if (domain != null) {
      builder.domain(domain);
    }
    if (expiry != null) {
      builder.expiresOn(new Date(expiry));
    }
    if (sameSite != null) {
      builder.sameSite(sameSite);
    }
    return builder.build();
  }
}
