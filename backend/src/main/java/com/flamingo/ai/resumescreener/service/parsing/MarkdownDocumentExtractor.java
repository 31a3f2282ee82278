package com.flamingo.ai.resumescreener.service.parsing;

import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.commonmark.node.Node;
import org.commonmark.parser.Parser;
import org.commonmark.renderer.text.TextContentRenderer;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * {@link DocumentTextExtractor} for Markdown resumes ({@code .md}, {@code text/markdown}).
 *
 * <p>Markup is stripped with commonmark's text renderer so headings and list markers do not leak
 * into skill matching. Each block ends up on its own line.
 */
@Service
@Order(1)
@RequiredArgsConstructor
public class MarkdownDocumentExtractor implements DocumentTextExtractor {

  private static final Set<String> SUPPORTED_TYPES = Set.of("text/markdown", "text/x-markdown");
  private static final Set<String> SUPPORTED_EXTENSIONS = Set.of(".md", ".markdown");

  private static final Parser PARSER = Parser.builder().build();
  private static final TextContentRenderer TEXT_RENDERER = TextContentRenderer.builder().build();

  private final PlainTextDocumentExtractor plainTextExtractor;

  @Override
  public boolean supports(String filename, String contentType) {
    return FileTypes.hasExtension(filename, SUPPORTED_EXTENSIONS)
        || (contentType != null
            && SUPPORTED_TYPES.contains(FileTypes.baseType(contentType)));
  }

  @Override
  public String extractText(String filename, byte[] content) {
    String markdown = plainTextExtractor.extractText(filename, content);
    Node document = PARSER.parse(markdown);
    return TEXT_RENDERER.render(document);
  }
}
