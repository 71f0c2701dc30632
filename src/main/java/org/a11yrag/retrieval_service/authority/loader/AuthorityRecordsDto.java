package org.a11yrag.retrieval_service.authority.loader;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/** JSON layout of the authority records file. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AuthorityRecordsDto {
  private String version;
  private List<AuthorDto> authors = new ArrayList<>();

  @Data
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class AuthorDto {
    private String id;
    private String name;
    private List<String> aliases = new ArrayList<>();
    private int level;
    private List<String> expertise = new ArrayList<>();
  }
}
