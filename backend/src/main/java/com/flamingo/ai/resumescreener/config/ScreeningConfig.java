package com.flamingo.ai.resumescreener.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for extraction, scoring and upload handling. */
@Configuration
@ConfigurationProperties(prefix = "screening")
@Getter
@Setter
public class ScreeningConfig {

  private Vocabulary vocabulary = new Vocabulary();
  private Scoring scoring = new Scoring();
  private Experience experience = new Experience();
  private Extraction extraction = new Extraction();
  private JobDescription jd = new JobDescription();
  private Upload upload = new Upload();

  @Getter
  @Setter
  public static class Vocabulary {
    /** Spring resource location of the skills/keywords/education dictionary. */
    private String location = "classpath:vocabulary/default-vocabulary.json";
  }

  @Getter
  @Setter
  public static class Scoring {
    private Weights weights = new Weights();

    /**
     * Relative weight of each category in the final percentage. Weights are normalized by their
     * sum, so they need not add up to 1.
     */
    @Getter
    @Setter
    public static class Weights {
      private double skills = 0.55;
      private double experience = 0.25;
      private double education = 0.10;
      private double keywords = 0.10;

      public double total() {
        return skills + experience + education + keywords;
      }
    }
  }

  @Getter
  @Setter
  public static class Experience {
    /** Upper bound for the extracted experience total, in years. */
    private double maxYears = 50.0;
  }

  /** Thread pool used to extract documents of a batch upload in parallel. */
  @Getter
  @Setter
  public static class Extraction {
    private int corePoolSize = 2;
    private int maxPoolSize = 4;
    private int queueCapacity = 100;
  }

  @Getter
  @Setter
  public static class JobDescription {
    /** Number of raw-text characters echoed back by the JD pre-fill endpoint. */
    private int previewLength = 1000;
  }

  @Getter
  @Setter
  public static class Upload {
    private int maxFiles = 100;
  }
}
