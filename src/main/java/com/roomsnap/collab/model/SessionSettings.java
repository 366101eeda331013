package com.roomsnap.collab.model;

import java.util.Objects;

/**
 * Settings chosen by the host when the session is created.
 */
public class SessionSettings {
    public static final int DEFAULT_MAX_PARTICIPANTS = 10;
    public static final int DEFAULT_EXPIRES_IN_MINUTES = 120;
    
    private final boolean allowEditing;
    private final boolean requireApproval;
    private final boolean autoSync;
    private final int maxParticipants;
    private final int expiresIn;
    
    private SessionSettings(Builder builder) {
        this.allowEditing = builder.allowEditing;
        this.requireApproval = builder.requireApproval;
        this.autoSync = builder.autoSync;
        this.maxParticipants = builder.maxParticipants;
        this.expiresIn = builder.expiresIn;
    }
    
    public static SessionSettings defaults() {
        return builder().build();
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public boolean isAllowEditing() {
        return allowEditing;
    }
    
    /**
     * Carried with the session for the host application; not enforced here.
     * @return Whether joins need host approval.
     */
    public boolean isRequireApproval() {
        return requireApproval;
    }
    
    public boolean isAutoSync() {
        return autoSync;
    }
    
    public int getMaxParticipants() {
        return maxParticipants;
    }
    
    /**
     * Gets the session lifetime counted from its creation.
     * @return The lifetime in minutes.
     */
    public int getExpiresIn() {
        return expiresIn;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        
        SessionSettings that = (SessionSettings) o;
        return allowEditing == that.allowEditing
                && requireApproval == that.requireApproval
                && autoSync == that.autoSync
                && maxParticipants == that.maxParticipants
                && expiresIn == that.expiresIn;
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(allowEditing, requireApproval, autoSync, maxParticipants, expiresIn);
    }
    
    public static class Builder {
        private boolean allowEditing = true;
        private boolean requireApproval = false;
        private boolean autoSync = true;
        private int maxParticipants = DEFAULT_MAX_PARTICIPANTS;
        private int expiresIn = DEFAULT_EXPIRES_IN_MINUTES;
        
        private Builder() {
        }
        
        public Builder allowEditing(boolean allowEditing) {
            this.allowEditing = allowEditing;
            return this;
        }
        
        public Builder requireApproval(boolean requireApproval) {
            this.requireApproval = requireApproval;
            return this;
        }
        
        public Builder autoSync(boolean autoSync) {
            this.autoSync = autoSync;
            return this;
        }
        
        public Builder maxParticipants(int maxParticipants) {
            if (maxParticipants < 1) {
                throw new IllegalArgumentException("maxParticipants must be positive: " + maxParticipants);
            }
            this.maxParticipants = maxParticipants;
            return this;
        }
        
        public Builder expiresIn(int minutes) {
            if (minutes < 1) {
                throw new IllegalArgumentException("expiresIn must be positive: " + minutes);
            }
            this.expiresIn = minutes;
            return this;
        }
        
        public SessionSettings build() {
            return new SessionSettings(this);
        }
    }
}
