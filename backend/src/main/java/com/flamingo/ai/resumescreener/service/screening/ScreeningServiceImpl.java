package com.flamingo.ai.resumescreener.service.screening;

import com.flamingo.ai.resumescreener.config.ScreeningConfig;
import com.flamingo.ai.resumescreener.domain.enums.MatchingMode;
import com.flamingo.ai.resumescreener.domain.model.Decision;
import com.flamingo.ai.resumescreener.domain.model.JobDescriptionAnalysis;
import com.flamingo.ai.resumescreener.domain.model.MatchResult;
import com.flamingo.ai.resumescreener.domain.model.ParsedProfile;
import com.flamingo.ai.resumescreener.domain.model.RequirementSet;
import com.flamingo.ai.resumescreener.domain.model.ScreenedCandidate;
import com.flamingo.ai.resumescreener.domain.model.SourceDocument;
import com.flamingo.ai.resumescreener.exception.DocumentProcessingException;
import com.flamingo.ai.resumescreener.exception.DuplicateIdentifierException;
import com.flamingo.ai.resumescreener.exception.InsufficientCandidatesException;
import com.flamingo.ai.resumescreener.exception.UnsupportedDocumentException;
import com.flamingo.ai.resumescreener.exception.UploadLimitExceededException;
import com.flamingo.ai.resumescreener.service.extraction.FactExtractor;
import com.flamingo.ai.resumescreener.service.extraction.RequirementExtractor;
import com.flamingo.ai.resumescreener.service.extraction.TextNormalizer;
import com.flamingo.ai.resumescreener.service.parsing.DocumentTextExtractor;
import com.flamingo.ai.resumescreener.service.scoring.DecisionEngine;
import com.flamingo.ai.resumescreener.service.scoring.MatchScorer;
import com.flamingo.ai.resumescreener.service.store.CandidateStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

/** Implementation of the ScreeningService. */
@Service
@Slf4j
public class ScreeningServiceImpl implements ScreeningService {

  private static final Comparator<ScreenedCandidate> BY_SCORE_DESC =
      Comparator.comparingDouble(ScreenedCandidate::score).reversed();

  private final TextNormalizer textNormalizer;
  private final FactExtractor factExtractor;
  private final RequirementExtractor requirementExtractor;
  private final MatchScorer matchScorer;
  private final DecisionEngine decisionEngine;
  private final CandidateStore candidateStore;
  private final List<DocumentTextExtractor> documentTextExtractors;
  private final ScreeningConfig screeningConfig;
  private final MeterRegistry meterRegistry;
  private final Executor extractionExecutor;

  public ScreeningServiceImpl(
      TextNormalizer textNormalizer,
      FactExtractor factExtractor,
      RequirementExtractor requirementExtractor,
      MatchScorer matchScorer,
      DecisionEngine decisionEngine,
      CandidateStore candidateStore,
      List<DocumentTextExtractor> documentTextExtractors,
      ScreeningConfig screeningConfig,
      MeterRegistry meterRegistry,
      @Qualifier("extractionExecutor") Executor extractionExecutor) {
    this.textNormalizer = textNormalizer;
    this.factExtractor = factExtractor;
    this.requirementExtractor = requirementExtractor;
    this.matchScorer = matchScorer;
    this.decisionEngine = decisionEngine;
    this.candidateStore = candidateStore;
    this.documentTextExtractors = documentTextExtractors;
    this.screeningConfig = screeningConfig;
    this.meterRegistry = meterRegistry;
    this.extractionExecutor = extractionExecutor;
  }

  @Override
  @Timed(value = "candidate.ingest", description = "Time to extract and store a batch")
  public List<ParsedProfile> ingest(List<SourceDocument> documents) {
    if (documents.isEmpty()) {
      return List.of();
    }
    log.info("Ingesting {} documents", documents.size());

    List<CompletableFuture<ParsedProfile>> futures = new ArrayList<>(documents.size());
    for (SourceDocument document : documents) {
      futures.add(
          CompletableFuture.supplyAsync(() -> extractProfile(document), extractionExecutor));
    }

    // Insert in input order regardless of completion order
    List<ParsedProfile> stored = new ArrayList<>(documents.size());
    for (CompletableFuture<ParsedProfile> future : futures) {
      stored.add(store(awaitExtraction(future)));
    }

    meterRegistry.counter("candidate.ingested").increment(stored.size());
    log.info("Ingested {} candidates, {} stored in total", stored.size(), candidateStore.size());
    return stored;
  }

  @Override
  @Timed(value = "candidate.upload", description = "Time to decode and ingest uploaded files")
  public List<ParsedProfile> upload(List<MultipartFile> files) {
    int maxFiles = screeningConfig.getUpload().getMaxFiles();
    if (files.size() > maxFiles) {
      throw new UploadLimitExceededException(files.size(), maxFiles);
    }

    List<SourceDocument> documents = new ArrayList<>();
    List<String> skipped = new ArrayList<>();
    for (MultipartFile file : files) {
      String filename = file.getOriginalFilename();
      Optional<DocumentTextExtractor> extractor = findExtractor(filename, file.getContentType());
      if (extractor.isEmpty()) {
        log.warn("Skipping unsupported file {} ({})", filename, file.getContentType());
        skipped.add(filename);
        continue;
      }
      String text = extractor.get().extractText(filename, read(file));
      documents.add(new SourceDocument(filename, text));
    }

    if (documents.isEmpty()) {
      throw new UnsupportedDocumentException(skipped);
    }
    return ingest(documents);
  }

  @Override
  public List<ParsedProfile> getCandidates() {
    return candidateStore.all();
  }

  @Override
  public int countCandidates() {
    return candidateStore.size();
  }

  @Override
  @Timed(value = "screening.filter", description = "Time to score all stored candidates")
  public List<ScreenedCandidate> filter(RequirementSet requirements) {
    List<ScreenedCandidate> screened = new ArrayList<>();
    for (ParsedProfile profile : candidateStore.all()) {
      ScreenedCandidate candidate = screen(profile, requirements);
      if (requirements.mode() == MatchingMode.RANKING || candidate.passed()) {
        screened.add(candidate);
      }
    }
    // List.sort is stable, so equal scores keep insertion order
    screened.sort(BY_SCORE_DESC);

    log.debug(
        "Filter in {} mode kept {} candidates", requirements.mode().wireName(), screened.size());
    return screened;
  }

  @Override
  @Timed(value = "screening.compare", description = "Time to compare selected candidates")
  public List<ScreenedCandidate> compare(List<String> ids, RequirementSet requirements) {
    Set<String> distinctIds = new LinkedHashSet<>();
    if (ids != null) {
      ids.stream().filter(id -> id != null && !id.isBlank()).forEach(distinctIds::add);
    }
    if (distinctIds.size() < InsufficientCandidatesException.MINIMUM) {
      throw new InsufficientCandidatesException(distinctIds.size(), 0);
    }

    List<ParsedProfile> profiles = candidateStore.getByIds(distinctIds);
    if (profiles.size() < InsufficientCandidatesException.MINIMUM) {
      throw new InsufficientCandidatesException(distinctIds.size(), profiles.size());
    }

    return profiles.stream().map(profile -> screen(profile, requirements)).toList();
  }

  @Override
  @Timed(value = "candidate.clear", description = "Time to clear the candidate store")
  public int clear() {
    int removed = candidateStore.clear();
    meterRegistry.counter("candidate.store.cleared").increment();
    log.info("Cleared candidate store, {} candidates removed", removed);
    return removed;
  }

  @Override
  @Timed(value = "jd.extract", description = "Time to derive requirements from a job description")
  public JobDescriptionAnalysis extractRequirements(MultipartFile file) {
    String filename = file.getOriginalFilename();
    DocumentTextExtractor extractor =
        findExtractor(filename, file.getContentType())
            .orElseThrow(() -> new UnsupportedDocumentException(List.of(String.valueOf(filename))));

    String text = extractor.extractText(filename, read(file));
    RequirementSet requirements = requirementExtractor.extract(text);

    int previewLength = screeningConfig.getJd().getPreviewLength();
    String preview = text.length() > previewLength ? text.substring(0, previewLength) : text;
    return new JobDescriptionAnalysis(filename, requirements, preview);
  }

  @Override
  public ScreenedCandidate screen(ParsedProfile profile, RequirementSet requirements) {
    MatchResult scored = matchScorer.score(profile, requirements);
    Decision decision = decisionEngine.decide(scored, requirements);
    meterRegistry
        .counter(
            "screening.decisions",
            "mode",
            requirements.mode().wireName(),
            "passed",
            String.valueOf(decision.passed()))
        .increment();
    return new ScreenedCandidate(profile, scored.withDecision(decision), requirements);
  }

  private ParsedProfile extractProfile(SourceDocument document) {
    String text = textNormalizer.normalize(document.text());
    return factExtractor.extract(newId(), document.filename(), text);
  }

  private ParsedProfile awaitExtraction(CompletableFuture<ParsedProfile> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException cause) {
        throw cause;
      }
      throw e;
    }
  }

  private ParsedProfile store(ParsedProfile profile) {
    try {
      candidateStore.add(profile);
      return profile;
    } catch (DuplicateIdentifierException e) {
      ParsedProfile retried = profile.withId(newId());
      log.warn(
          "Candidate id {} already taken, retrying {} as {}",
          profile.id(),
          profile.filename(),
          retried.id());
      candidateStore.add(retried);
      return retried;
    }
  }

  private Optional<DocumentTextExtractor> findExtractor(String filename, String contentType) {
    return documentTextExtractors.stream()
        .filter(extractor -> extractor.supports(filename, contentType))
        .findFirst();
  }

  private byte[] read(MultipartFile file) {
    try {
      return file.getBytes();
    } catch (IOException e) {
      throw new DocumentProcessingException(
          file.getOriginalFilename(), "Failed to read uploaded file: " + e.getMessage(), e);
    }
  }

  private static String newId() {
    return UUID.randomUUID().toString();
  }
}
