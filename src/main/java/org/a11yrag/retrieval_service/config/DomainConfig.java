package org.a11yrag.retrieval_service.config;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Built-in accessibility and technology domains with their indicator terms. Properties loaded from
 * {@code application.properties} with prefix {@code ontology.domains}, e.g. {@code
 * ontology.domains.technology.svg=title,desc,role img}. A configured domain replaces the built-in
 * one of the same name.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "ontology.domains")
public class DomainConfig {

  private Map<String, List<String>> accessibility = new LinkedHashMap<>();
  private Map<String, List<String>> technology = new LinkedHashMap<>();

  public DomainConfig() {
    accessibility.put(
        "visual",
        List.of(
            "blindness",
            "low vision",
            "color blindness",
            "photosensitivity",
            "screen reader",
            "magnification",
            "high contrast"));
    accessibility.put(
        "motor",
        List.of(
            "limited fine motor",
            "tremor",
            "paralysis",
            "switch navigation",
            "keyboard only",
            "voice control",
            "eye tracking"));
    accessibility.put(
        "cognitive",
        List.of(
            "dyslexia",
            "adhd",
            "memory issues",
            "processing disorders",
            "autism",
            "learning disabilities",
            "cognitive load"));
    accessibility.put(
        "auditory",
        List.of(
            "deafness",
            "hard of hearing",
            "auditory processing",
            "captions",
            "transcripts",
            "sign language"));

    technology.put(
        "html",
        List.of(
            "semantic elements",
            "forms",
            "tables",
            "images",
            "landmarks",
            "headings",
            "lists",
            "links",
            "buttons"));
    technology.put(
        "aria",
        List.of(
            "roles",
            "properties",
            "states",
            "live regions",
            "labels",
            "descriptions",
            "controls",
            "expanded",
            "hidden"));
    technology.put(
        "css",
        List.of(
            "focus indicators",
            "responsive design",
            "animations",
            "transforms",
            "visibility",
            "color contrast",
            "typography",
            "layout"));
    technology.put(
        "javascript",
        List.of(
            "dynamic content",
            "spa navigation",
            "event handling",
            "ajax",
            "progressive enhancement",
            "frameworks",
            "libraries"));
  }
}
