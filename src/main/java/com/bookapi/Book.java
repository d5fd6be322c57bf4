package com.bookapi;

public class Book {
    private Long id;
    private String title;
    private String author;
    private String summary;

    public Book() {}

    public Book(Long id, String title, String author, String summary) {
        this.id = id;
        this.title = title;
        this.author = author;
        this.summary = summary;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getAuthor() { return author; }
    public void setAuthor(String author) { this.author = author; }

    /** UTF-8 text; persisted as the raw bytes of that encoding. */
    public String getSummary() { return summary; }
    public void setSummary(String summary) { this.summary = summary; }

    public Book withId(long newId) {
        return new Book(newId, title, author, summary);
    }
}
