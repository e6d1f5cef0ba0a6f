package com.example.icc.auth;

import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Identity resolved for one request: the user or {@link #ANONYMOUS_USER_ID}.
 */
@Value
@AllArgsConstructor
public class AuthContext {

    public static final long ANONYMOUS_USER_ID = 0;

    public static final AuthContext ANONYMOUS = new AuthContext(ANONYMOUS_USER_ID);

    long userId;

    public boolean isAnonymous() {
        return userId == ANONYMOUS_USER_ID;
    }
}
