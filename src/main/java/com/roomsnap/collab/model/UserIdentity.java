package com.roomsnap.collab.model;

/**
 * The authenticated user on whose behalf the engine acts.
 * Supplied by the identity provider; never created by this engine.
 */
public class UserIdentity {
    private final String userId;
    private final String displayName;
    
    public UserIdentity(String userId, String displayName) {
        if (userId == null || userId.isEmpty()) {
            throw new IllegalArgumentException("userId is required");
        }
        this.userId = userId;
        this.displayName = displayName;
    }
    
    public String getUserId() {
        return userId;
    }
    
    public String getDisplayName() {
        return displayName;
    }
    
    /**
     * Gets the participant id this user is known by inside a session.
     * @return The participant id.
     */
    public String participantId() {
        return "participant_" + userId;
    }
    
    @Override
    public String toString() {
        return displayName + " (" + userId + ")";
    }
}
