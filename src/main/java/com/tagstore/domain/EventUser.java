package com.tagstore.domain;

/**
 * Identity of an end user as recorded on events. Any of the identity fields may
 * be blank; blank fields are not used for matching.
 */
public class EventUser {

    private final long projectId;
    private final String ident;
    private final String email;
    private final String username;
    private final String ipAddress;

    public EventUser(long projectId, String ident, String email, String username, String ipAddress) {
        this.projectId = projectId;
        this.ident = ident;
        this.email = email;
        this.username = username;
        this.ipAddress = ipAddress;
    }

    public long getProjectId() {
        return projectId;
    }

    public String getIdent() {
        return ident;
    }

    public String getEmail() {
        return email;
    }

    public String getUsername() {
        return username;
    }

    public String getIpAddress() {
        return ipAddress;
    }

    @Override
    public String toString() {
        return "EventUser{projectId=" + projectId + ", ident='" + ident + "', email='" + email
            + "', username='" + username + "', ipAddress='" + ipAddress + "'}";
    }
}
