package com.ospicorp.salesinsights.web;

import java.util.Comparator;
import java.util.List;
import org.springframework.http.MediaType;
import org.springframework.util.MimeTypeUtils;
import org.springframework.util.StringUtils;

/** Picks JSON or CSV from an explicit {@code format} parameter, then from {@code Accept}. */
public final class ResponseFormats {
  public static final MediaType CSV = MediaType.valueOf("text/csv");

  private ResponseFormats() {
  }

  public static MediaType select(String format, String accept) {
    if (StringUtils.hasText(format)) {
      if ("csv".equalsIgnoreCase(format)) {
        return CSV;
      }
      if ("json".equalsIgnoreCase(format)) {
        return MediaType.APPLICATION_JSON;
      }
      throw new InvalidParameterException("Invalid format value. Supported values: json,csv.", 1007);
    }
    if (!StringUtils.hasText(accept)) {
      return MediaType.APPLICATION_JSON;
    }
    List<MediaType> mediaTypes = MediaType.parseMediaTypes(accept);
    mediaTypes.sort(Comparator.comparingDouble(MediaType::getQualityValue).reversed());
    MimeTypeUtils.sortBySpecificity(mediaTypes);
    for (MediaType mediaType : mediaTypes) {
      if (mediaType.isCompatibleWith(MediaType.APPLICATION_JSON)) {
        return MediaType.APPLICATION_JSON;
      }
      if (mediaType.isCompatibleWith(CSV)) {
        return CSV;
      }
    }
    return MediaType.APPLICATION_JSON;
  }

  public static boolean isCsv(MediaType mediaType) {
    return mediaType.isCompatibleWith(CSV);
  }
}
