package com.quantori.bqp.executor.ncbi;

import com.quantori.bqp.api.RemoteJobFailedException;
import com.quantori.bqp.api.RemoteSubmissionException;
import com.quantori.bqp.api.SearchCancelledException;
import com.quantori.bqp.api.model.AdvancedParameters;
import com.quantori.bqp.api.model.BlastProgram;
import com.quantori.bqp.api.model.RemoteJobStatus;
import com.quantori.bqp.api.model.SearchRequest;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

@Slf4j
public class HttpNcbiBlastApi implements NcbiBlastApi {
  static final int DEFAULT_WORD_SIZE = 11;
  static final String DEFAULT_MATRIX = "BLOSUM62";
  static final int DEFAULT_GAP_OPEN = 11;
  static final int DEFAULT_GAP_EXTEND = 1;

  private final NcbiBlastProperties properties;
  private final HttpClient httpClient;

  public HttpNcbiBlastApi(NcbiBlastProperties properties) {
    this(
        properties,
        HttpClient.newBuilder()
            .connectTimeout(properties.getConnectTimeout())
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build());
  }

  HttpNcbiBlastApi(NcbiBlastProperties properties, HttpClient httpClient) {
    this.properties = properties;
    this.httpClient = httpClient;
  }

  @Override
  public String submit(SearchRequest request, String database) {
    String form = encode(submitParameters(request, database, properties));
    HttpRequest httpRequest =
        HttpRequest.newBuilder(properties.getUrl())
            .timeout(properties.getRequestTimeout())
            .header("Content-Type", "application/x-www-form-urlencoded")
            .POST(HttpRequest.BodyPublishers.ofString(form))
            .build();
    HttpResponse<String> response;
    try {
      response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new RemoteSubmissionException("Cannot reach NCBI BLAST: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SearchCancelledException("Interrupted while submitting the search");
    }
    if (response.statusCode() >= 400) {
      throw new RemoteSubmissionException(
          "NCBI BLAST rejected the search with HTTP status " + response.statusCode(),
          response.body());
    }
    return response.body();
  }

  @Override
  public String poll(String requestId) {
    return get(requestId, Map.of("CMD", "Get", "FORMAT_OBJECT", "SearchInfo", "RID", requestId));
  }

  @Override
  public String retrieve(String requestId, String formatType) {
    return get(requestId, Map.of("CMD", "Get", "FORMAT_TYPE", formatType, "RID", requestId));
  }

  private String get(String requestId, Map<String, String> parameters) {
    URI uri = URI.create(properties.getUrl() + "?" + encode(new LinkedHashMap<>(parameters)));
    log.trace("GET {}", uri);
    HttpRequest httpRequest =
        HttpRequest.newBuilder(uri).timeout(properties.getRequestTimeout()).GET().build();
    try {
      HttpResponse<String> response =
          httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
      if (response.statusCode() >= 400) {
        throw new RemoteJobFailedException(
            requestId,
            RemoteJobStatus.FAILED,
            "NCBI BLAST request failed with HTTP status " + response.statusCode());
      }
      return response.body();
    } catch (IOException e) {
      throw new RemoteJobFailedException(
          requestId, RemoteJobStatus.FAILED, "Cannot reach NCBI BLAST: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SearchCancelledException("Interrupted while waiting for job " + requestId);
    }
  }

  static Map<String, String> submitParameters(
      SearchRequest request, String database, NcbiBlastProperties properties) {
    BlastProgram program = request.getProgram();
    AdvancedParameters advanced =
        Objects.requireNonNullElseGet(
            request.getAdvanced(), () -> AdvancedParameters.builder().build());
    Map<String, String> parameters = new LinkedHashMap<>();
    parameters.put("CMD", "Put");
    parameters.put("PROGRAM", program.getCommand());
    parameters.put("DATABASE", database);
    parameters.put("QUERY", request.getSequence());
    parameters.put("EXPECT", Double.toString(request.getEvalueThreshold()));
    parameters.put("HITLIST_SIZE", Integer.toString(request.getMaxTargets()));
    parameters.put("FORMAT_TYPE", "XML");
    if (program == BlastProgram.BLASTN) {
      parameters.put(
          "WORD_SIZE",
          Integer.toString(
              Objects.requireNonNullElse(advanced.getWordSize(), DEFAULT_WORD_SIZE)));
    } else {
      parameters.put(
          "MATRIX_NAME", StringUtils.defaultIfBlank(advanced.getMatrix(), DEFAULT_MATRIX));
      parameters.put(
          "GAPCOSTS",
          Objects.requireNonNullElse(advanced.getGapOpen(), DEFAULT_GAP_OPEN)
              + " "
              + Objects.requireNonNullElse(advanced.getGapExtend(), DEFAULT_GAP_EXTEND));
    }
    if (advanced.isLowComplexityFilter()) {
      parameters.put("FILTER", "L");
    }
    if (StringUtils.isNotBlank(properties.getTool())) {
      parameters.put("TOOL", properties.getTool());
    }
    if (StringUtils.isNotBlank(properties.getEmail())) {
      parameters.put("EMAIL", properties.getEmail());
    }
    return parameters;
  }

  static String encode(Map<String, String> parameters) {
    return parameters.entrySet().stream()
        .map(
            entry ->
                URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8)
                    + "="
                    + URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8))
        .collect(Collectors.joining("&"));
  }
}
