package com.roomsnap.collab.model;

import java.util.Objects;

/**
 * Payload of a chat envelope.
 */
public class ChatMessage {
    private final String message;
    private final String author;
    private final String color;
    
    public ChatMessage(String message, String author, String color) {
        this.message = message;
        this.author = author;
        this.color = color;
    }
    
    public String getMessage() {
        return message;
    }
    
    public String getAuthor() {
        return author;
    }
    
    public String getColor() {
        return color;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        
        ChatMessage that = (ChatMessage) o;
        return Objects.equals(message, that.message)
                && Objects.equals(author, that.author)
                && Objects.equals(color, that.color);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(message, author, color);
    }
    
    @Override
    public String toString() {
        return author + ": " + message;
    }
}
