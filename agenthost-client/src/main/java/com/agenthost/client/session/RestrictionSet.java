package com.agenthost.client.session;

/**
 * What the user may do while a session is in front.
 */
public record RestrictionSet(boolean canSwitchSessions, boolean canAccessHistory, boolean canFreeTypeText,
        boolean canEndEarly) {

    public static final RestrictionSet PERMISSIVE = new RestrictionSet(true, true, true, true);
    public static final RestrictionSet STRICT = new RestrictionSet(false, false, false, false);

    public RestrictionSet withCanSwitchSessions(boolean value) {
        return new RestrictionSet(value, canAccessHistory, canFreeTypeText, canEndEarly);
    }

    public RestrictionSet withCanAccessHistory(boolean value) {
        return new RestrictionSet(canSwitchSessions, value, canFreeTypeText, canEndEarly);
    }

    public RestrictionSet withCanFreeTypeText(boolean value) {
        return new RestrictionSet(canSwitchSessions, canAccessHistory, value, canEndEarly);
    }

    public RestrictionSet withCanEndEarly(boolean value) {
        return new RestrictionSet(canSwitchSessions, canAccessHistory, canFreeTypeText, value);
    }
}
