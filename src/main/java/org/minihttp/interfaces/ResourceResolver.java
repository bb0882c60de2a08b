package org.minihttp.interfaces;

import org.minihttp.http.HttpRequest;
import org.minihttp.http.HttpResponse;

/** Maps a parsed request to the response to send. Never throws; failures become error responses. */
public interface ResourceResolver {
    HttpResponse resolve(HttpRequest request);
}
