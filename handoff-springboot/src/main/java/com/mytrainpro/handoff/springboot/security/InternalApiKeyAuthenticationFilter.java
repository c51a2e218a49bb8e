package com.mytrainpro.handoff.springboot.security;

import com.mytrainpro.handoff.server.auth.InternalApiKey;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Grants {@link #INTERNAL_ROLE} to requests carrying the configured internal API key. A missing
 * or wrong key leaves the request as it was.
 */
public class InternalApiKeyAuthenticationFilter extends OncePerRequestFilter {

  static final String INTERNAL_ROLE = "HANDOFF_INTERNAL";
  static final String INTERNAL_PRINCIPAL = "handoff-internal";

  private final InternalApiKey internalApiKey;

  public InternalApiKeyAuthenticationFilter(InternalApiKey internalApiKey) {
    this.internalApiKey = internalApiKey;
  }

  @Override
  protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                  FilterChain filterChain) throws ServletException, IOException {
    if (internalApiKey.matches(request.getHeader(InternalApiKey.HEADER))) {
      UsernamePasswordAuthenticationToken auth = new UsernamePasswordAuthenticationToken(
          INTERNAL_PRINCIPAL, null, List.of(new SimpleGrantedAuthority("ROLE_" + INTERNAL_ROLE)));
      SecurityContextHolder.getContext().setAuthentication(auth);
    }
    filterChain.doFilter(request, response);
  }
}
