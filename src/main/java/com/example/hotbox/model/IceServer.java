package com.example.hotbox.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/** RTCIceServer descriptor handed to clients. STUN entries carry no credentials. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IceServer(List<String> urls, String username, String credential) {

    public static IceServer stun(List<String> urls) {
        return new IceServer(List.copyOf(urls), null, null);
    }

    public static IceServer turn(String url, String username, String credential) {
        return new IceServer(List.of(url), username, credential);
    }
}
