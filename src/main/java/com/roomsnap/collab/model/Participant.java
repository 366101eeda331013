package com.roomsnap.collab.model;

import com.google.gson.annotations.SerializedName;

import java.util.Objects;

/**
 * One identity inside a session. Participants are never removed from a
 * session; leaving only marks them inactive so attribution survives.
 */
public class Participant {
    private final String id;
    private final String userId;
    private final String name;
    private final Role role;
    private final String color;
    @SerializedName("isActive")
    private final boolean active;
    private final long joinedAt;
    private final long lastSeen;
    
    public Participant(String id, String userId, String name, Role role, String color,
                       boolean active, long joinedAt, long lastSeen) {
        this.id = id;
        this.userId = userId;
        this.name = name;
        this.role = role;
        this.color = color;
        this.active = active;
        this.joinedAt = joinedAt;
        this.lastSeen = lastSeen;
    }
    
    public String getId() {
        return id;
    }
    
    public String getUserId() {
        return userId;
    }
    
    public String getName() {
        return name;
    }
    
    public Role getRole() {
        return role;
    }
    
    public String getColor() {
        return color;
    }
    
    public boolean isActive() {
        return active;
    }
    
    public long getJoinedAt() {
        return joinedAt;
    }
    
    public long getLastSeen() {
        return lastSeen;
    }
    
    /**
     * Returns a copy of this participant with a new presence state.
     * @param active Whether the participant is currently in the session.
     * @param lastSeen When the participant was last seen, in epoch millis.
     * @return The updated participant.
     */
    public Participant withPresence(boolean active, long lastSeen) {
        return new Participant(id, userId, name, role, color, active, joinedAt, lastSeen);
    }
    
    public Participant withRole(Role newRole) {
        return new Participant(id, userId, name, newRole, color, active, joinedAt, lastSeen);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        
        Participant that = (Participant) o;
        return active == that.active
                && joinedAt == that.joinedAt
                && lastSeen == that.lastSeen
                && Objects.equals(id, that.id)
                && Objects.equals(userId, that.userId)
                && Objects.equals(name, that.name)
                && role == that.role
                && Objects.equals(color, that.color);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(id, userId, name, role, color, active, joinedAt, lastSeen);
    }
    
    @Override
    public String toString() {
        return "Participant{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", role=" + role +
                ", active=" + active +
                '}';
    }
}
