package org.terrastories.policy.infrastructure.security;

import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.terrastories.policy.domain.model.Actor;

import java.util.List;
import java.util.Objects;

/**
 * Authenticated session carrying the resolved {@link Actor}.
 *
 * <p>Set by the authentication layer once the session has been verified; this module only
 * reads it.
 */
public class CommunityAuthenticationToken extends AbstractAuthenticationToken {

    private static final long serialVersionUID = 1L;

    private final Actor actor;

    public CommunityAuthenticationToken(Actor actor) {
        super(List.of(new SimpleGrantedAuthority(
            "ROLE_" + Objects.requireNonNull(actor, "Actor must not be null").getRole().name()
        )));
        this.actor = actor;
        setAuthenticated(true);
    }

    public Actor getActor() {
        return actor;
    }

    @Override
    public Object getCredentials() {
        return null;
    }

    @Override
    public Object getPrincipal() {
        return actor;
    }
}
