package com.example.convoy.couch;

import org.springframework.util.StringUtils;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@AllArgsConstructor
@ToString(exclude = "password")
public class CouchDbSettings {

    private final String host;
    private final int port;
    private final String name;
    private final String login;
    private final String password;

    public String baseUrl() {
        return "http://" + host + ":" + port;
    }

    public boolean isAuthorized() {
        return StringUtils.hasText(login) && StringUtils.hasText(password);
    }
}
