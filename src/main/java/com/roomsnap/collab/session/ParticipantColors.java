package com.roomsnap.collab.session;

import java.util.List;

/**
 * Display colours for participants, stable per user.
 */
public final class ParticipantColors {
    private static final List<String> PALETTE = List.of(
            "#FF6B6B", "#4ECDC4", "#45B7D1", "#96CEB4", "#FFEAA7",
            "#DDA5E9", "#FF8CC6", "#6C5CE7", "#A29BFE", "#FD79A8");
    
    private ParticipantColors() {
    }
    
    public static String forUser(String userId) {
        return PALETTE.get(Math.floorMod(userId.hashCode(), PALETTE.size()));
    }
    
    public static List<String> palette() {
        return PALETTE;
    }
}
