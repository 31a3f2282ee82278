package com.flamingo.ai.resumescreener.service.parsing;

import java.util.Locale;
import java.util.Set;

/** File name and MIME type helpers shared by the extractors. */
final class FileTypes {

  private FileTypes() {}

  static boolean hasExtension(String filename, Set<String> extensions) {
    if (filename == null) {
      return false;
    }
    String lower = filename.toLowerCase(Locale.ROOT);
    return extensions.stream().anyMatch(lower::endsWith);
  }

  /** Strips parameters such as {@code ; charset=utf-8}. */
  static String baseType(String contentType) {
    int semicolon = contentType.indexOf(';');
    String base = semicolon >= 0 ? contentType.substring(0, semicolon) : contentType;
    return base.trim().toLowerCase(Locale.ROOT);
  }
}
