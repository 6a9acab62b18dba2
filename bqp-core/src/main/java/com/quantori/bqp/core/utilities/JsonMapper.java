package com.quantori.bqp.core.utilities;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.quantori.bqp.api.model.DatabaseRecord;
import com.quantori.bqp.api.model.SearchResult;
import java.util.List;
import lombok.experimental.UtilityClass;

@UtilityClass
public class JsonMapper {

  private static final ObjectMapper OBJECT_MAPPER =
      new ObjectMapper()
          .registerModule(new JavaTimeModule())
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
          .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

  private static final TypeReference<List<DatabaseRecord>> RECORD_LIST = new TypeReference<>() {};

  public static String toJsonString(List<DatabaseRecord> records) throws JsonProcessingException {
    return OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(records);
  }

  public static List<DatabaseRecord> toDatabaseRecords(String json) throws JsonProcessingException {
    return OBJECT_MAPPER.readValue(json, RECORD_LIST);
  }

  public static String toJsonString(SearchResult result) throws JsonProcessingException {
    return OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(result);
  }
}
