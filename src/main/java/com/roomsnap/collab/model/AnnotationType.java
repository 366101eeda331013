package com.roomsnap.collab.model;

import com.google.gson.annotations.SerializedName;

public enum AnnotationType {
    @SerializedName("text")
    TEXT,
    @SerializedName("arrow")
    ARROW,
    @SerializedName("circle")
    CIRCLE,
    @SerializedName("freehand")
    FREEHAND
}
