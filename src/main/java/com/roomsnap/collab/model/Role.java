package com.roomsnap.collab.model;

import com.google.gson.annotations.SerializedName;

/**
 * The role of a participant, governing its edit rights.
 */
public enum Role {
    @SerializedName("host")
    HOST,
    @SerializedName("editor")
    EDITOR,
    @SerializedName("viewer")
    VIEWER;
    
    /**
     * Whether this role may create and modify shared content.
     * @return true for hosts and editors.
     */
    public boolean canEdit() {
        return this == HOST || this == EDITOR;
    }
}
