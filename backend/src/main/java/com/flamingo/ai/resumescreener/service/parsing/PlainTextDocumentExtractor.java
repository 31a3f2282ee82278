package com.flamingo.ai.resumescreener.service.parsing;

import com.flamingo.ai.resumescreener.exception.DocumentProcessingException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Set;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/** {@link DocumentTextExtractor} for UTF-8 plain text ({@code .txt}, {@code text/plain}). */
@Service
@Order(2)
public class PlainTextDocumentExtractor implements DocumentTextExtractor {

  private static final Set<String> SUPPORTED_TYPES = Set.of("text/plain");
  private static final Set<String> SUPPORTED_EXTENSIONS = Set.of(".txt", ".text");

  @Override
  public boolean supports(String filename, String contentType) {
    return FileTypes.hasExtension(filename, SUPPORTED_EXTENSIONS)
        || (contentType != null
            && SUPPORTED_TYPES.contains(FileTypes.baseType(contentType)));
  }

  @Override
  public String extractText(String filename, byte[] content) {
    try {
      return StandardCharsets.UTF_8
          .newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(content))
          .toString();
    } catch (CharacterCodingException e) {
      throw new DocumentProcessingException(
          filename, "Document is not valid UTF-8 text: " + filename, e);
    }
  }
}
