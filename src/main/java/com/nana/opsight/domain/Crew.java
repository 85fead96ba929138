package com.nana.opsight.domain;

import java.time.LocalDateTime;

/**
 * A named group of operators that works the same rotation.
 */
public class Crew {

    private long id;
    private String name;
    private LocalDateTime createdAt;

    public Crew() {
    }

    public Crew(String name) {
        this.name = name;
    }

    public long getId()                       { return id; }
    public void setId(long id)                { this.id = id; }
    public String getName()                   { return name; }
    public void setName(String name)          { this.name = name; }
    public LocalDateTime getCreatedAt()       { return createdAt; }
    public void setCreatedAt(LocalDateTime v) { this.createdAt = v; }

    @Override
    public String toString() {
        return "Crew{id=" + id + ", name='" + name + "'}";
    }
}
