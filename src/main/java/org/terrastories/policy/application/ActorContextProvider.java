package org.terrastories.policy.application;

import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.terrastories.policy.domain.model.Actor;
import org.terrastories.policy.infrastructure.security.CommunityAuthenticationToken;

/**
 * Provider for the current {@link Actor} from Spring Security.
 *
 * <p>Resolved fresh on every call; role or community may change between requests of the same
 * session.
 */
@Component
public class ActorContextProvider {

    public Actor getCurrentActor() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication == null || !authentication.isAuthenticated()) {
            throw new AuthenticationCredentialsNotFoundException("No authenticated user");
        }
        if (!(authentication instanceof CommunityAuthenticationToken)) {
            throw new AuthenticationCredentialsNotFoundException(
                "Unsupported authentication type: " + authentication.getClass().getSimpleName()
            );
        }

        return ((CommunityAuthenticationToken) authentication).getActor();
    }
}
