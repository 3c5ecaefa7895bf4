package com.streamfirst.indexinsight.adapters.elasticsearch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamfirst.indexinsight.ports.PortException;
import java.io.IOException;
import java.io.InputStream;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.elasticsearch.client.Request;
import org.elasticsearch.client.Response;
import org.elasticsearch.client.RestClient;

/** Executes requests and reads JSON responses, translating transport failures. */
@RequiredArgsConstructor
final class RestJson {

  @NonNull private final RestClient client;
  @NonNull private final ObjectMapper mapper;

  ObjectMapper mapper() {
    return mapper;
  }

  /**
   * Performs the request and parses the response body.
   *
   * @param operation short description used in error messages
   * @throws PortException on transport errors and non-2xx responses
   */
  JsonNode perform(Request request, String operation) {
    try {
      Response response = client.performRequest(request);
      try (InputStream body = response.getEntity().getContent()) {
        return mapper.readTree(body);
      }
    } catch (IOException e) {
      throw new PortException("Failed to " + operation + ": " + e.getMessage(), e);
    }
  }

  String toJson(Object value, String operation) {
    try {
      return mapper.writeValueAsString(value);
    } catch (IOException e) {
      throw new PortException("Failed to serialize request body to " + operation, e);
    }
  }

  /** Encodes an index name for use as a path segment. */
  static String path(String index) {
    return URLEncoder.encode(index, StandardCharsets.UTF_8);
  }
}
