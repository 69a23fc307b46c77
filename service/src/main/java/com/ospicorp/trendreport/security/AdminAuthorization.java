package com.ospicorp.trendreport.security;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.stereotype.Component;

/**
 * Decides admin access for {@code @PreAuthorize} expressions. With authentication disabled every
 * caller is admitted; otherwise the JWT must carry the admin scope.
 */
@Component("adminAuthorization")
public class AdminAuthorization {
  private final String scope;
  private final boolean authEnabled;

  public AdminAuthorization(@Value("${security.admin.scope:reports:refresh}") String scope,
      @Value("${security.auth.enabled:false}") boolean authEnabled) {
    this.scope = scope;
    this.authEnabled = authEnabled;
  }

  public String scope() {
    return scope;
  }

  public boolean permits(Authentication authentication) {
    if (!authEnabled) {
      return true;
    }
    if (authentication == null || !authentication.isAuthenticated()) {
      return false;
    }
    String required = "SCOPE_" + scope;
    for (GrantedAuthority authority : authentication.getAuthorities()) {
      if (required.equals(authority.getAuthority())) {
        return true;
      }
    }
    return false;
  }
}
