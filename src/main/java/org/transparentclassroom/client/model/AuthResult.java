package org.transparentclassroom.client.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of authenticating against the API: the session token plus the authenticated user.
 */
@Getter
@AllArgsConstructor
@ToString(exclude = "apiToken")
public class AuthResult {

    private final String apiToken;
    private final Integer schoolId;
    private final User user;

}
