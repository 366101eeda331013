package com.roomsnap.collab.model;

import java.util.Objects;

/**
 * A note, arrow, circle or freehand mark anchored in the shared space.
 * Annotations are not versioned: a remote write replaces the local copy.
 */
public class Annotation {
    private final String id;
    private final String authorId;
    private final AnnotationType type;
    private final Point3 position;
    private final String content;
    private final AnnotationStyle style;
    private final long timestamp;
    
    public Annotation(String id, String authorId, AnnotationType type, Point3 position,
                      String content, AnnotationStyle style, long timestamp) {
        this.id = id;
        this.authorId = authorId;
        this.type = type;
        this.position = position;
        this.content = content;
        this.style = style;
        this.timestamp = timestamp;
    }
    
    public String getId() {
        return id;
    }
    
    public String getAuthorId() {
        return authorId;
    }
    
    public AnnotationType getType() {
        return type;
    }
    
    public Point3 getPosition() {
        return position;
    }
    
    public String getContent() {
        return content;
    }
    
    public AnnotationStyle getStyle() {
        return style;
    }
    
    public long getTimestamp() {
        return timestamp;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        
        Annotation that = (Annotation) o;
        return timestamp == that.timestamp
                && Objects.equals(id, that.id)
                && Objects.equals(authorId, that.authorId)
                && type == that.type
                && Objects.equals(position, that.position)
                && Objects.equals(content, that.content)
                && Objects.equals(style, that.style);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(id, authorId, type, position, content, style, timestamp);
    }
    
    @Override
    public String toString() {
        return "Annotation{" +
                "id='" + id + '\'' +
                ", type=" + type +
                ", content='" + content + '\'' +
                '}';
    }
}
