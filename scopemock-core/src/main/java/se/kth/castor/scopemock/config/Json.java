package se.kth.castor.scopemock.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;

public class Json {

  private final ObjectMapper objectMapper = new ObjectMapper();

  public <T> T fromJson(String input, Class<T> clazz) throws IOException {
    return objectMapper.readValue(input, clazz);
  }

  public <T> T fromJson(InputStream input, Class<T> clazz) throws IOException {
    return objectMapper.readValue(input, clazz);
  }

  public String toJson(Object value) throws IOException {
    return objectMapper.writeValueAsString(value);
  }

}
