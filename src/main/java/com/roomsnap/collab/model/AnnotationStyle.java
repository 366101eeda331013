package com.roomsnap.collab.model;

import java.util.Objects;

/**
 * Visual style of an annotation. Font size and stroke width are optional.
 */
public class AnnotationStyle {
    public static final int DEFAULT_FONT_SIZE = 14;
    public static final int DEFAULT_STROKE_WIDTH = 2;
    
    private final String color;
    private final Integer fontSize;
    private final Integer strokeWidth;
    
    public AnnotationStyle(String color, Integer fontSize, Integer strokeWidth) {
        this.color = color;
        this.fontSize = fontSize;
        this.strokeWidth = strokeWidth;
    }
    
    /**
     * Creates the default style for a participant colour.
     * @param color The participant colour.
     * @return The style.
     */
    public static AnnotationStyle defaultFor(String color) {
        return new AnnotationStyle(color, DEFAULT_FONT_SIZE, DEFAULT_STROKE_WIDTH);
    }
    
    /**
     * Fills any unset property of this style from the given defaults.
     * @param defaults The style to take missing values from.
     * @return The merged style.
     */
    public AnnotationStyle withDefaults(AnnotationStyle defaults) {
        return new AnnotationStyle(
                color != null ? color : defaults.color,
                fontSize != null ? fontSize : defaults.fontSize,
                strokeWidth != null ? strokeWidth : defaults.strokeWidth);
    }
    
    public String getColor() {
        return color;
    }
    
    public Integer getFontSize() {
        return fontSize;
    }
    
    public Integer getStrokeWidth() {
        return strokeWidth;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        
        AnnotationStyle that = (AnnotationStyle) o;
        return Objects.equals(color, that.color)
                && Objects.equals(fontSize, that.fontSize)
                && Objects.equals(strokeWidth, that.strokeWidth);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(color, fontSize, strokeWidth);
    }
}
