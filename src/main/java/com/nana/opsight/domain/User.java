package com.nana.opsight.domain;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * User - an account of the monitoring tool itself.
 *
 * <p>Users are unrelated to the ICS operators whose behaviour is recorded;
 * they are the analysts and administrators who look at the results.
 * Username and email are each unique across all users.
 */
public class User {

    private long id;
    private String username;
    private String passwordHash;
    private UserRole role;
    private String email;
    private boolean active;
    private LocalDateTime createdAt;
    private LocalDateTime lastLogin;

    public User() {
        this.role   = UserRole.VIEWER;
        this.active = true;
    }

    public User(String username, String passwordHash, UserRole role, String email) {
        this();
        this.username     = username;
        this.passwordHash = passwordHash;
        this.role         = role;
        this.email        = email;
    }

    public long getId()                    { return id; }
    public void setId(long id)             { this.id = id; }

    public String getUsername()            { return username; }
    public void setUsername(String v)      { this.username = v; }

    public String getPasswordHash()        { return passwordHash; }
    public void setPasswordHash(String v)  { this.passwordHash = v; }

    public UserRole getRole()              { return role; }
    public void setRole(UserRole role)     { this.role = role; }

    public String getEmail()               { return email; }
    public void setEmail(String email)     { this.email = email; }

    public boolean isActive()              { return active; }
    public void setActive(boolean active)  { this.active = active; }

    public LocalDateTime getCreatedAt()         { return createdAt; }
    public void setCreatedAt(LocalDateTime v)   { this.createdAt = v; }

    /** @return the last successful login, or null if the user never logged in */
    public LocalDateTime getLastLogin()         { return lastLogin; }
    public void setLastLogin(LocalDateTime v)   { this.lastLogin = v; }

    /** Two users are equal when their usernames match. */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof User other)) return false;
        return Objects.equals(username, other.username);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(username);
    }

    @Override
    public String toString() {
        // Never print the password hash.
        return "User{id=" + id + ", username='" + username + "', role=" + role
               + ", active=" + active + "}";
    }
}
