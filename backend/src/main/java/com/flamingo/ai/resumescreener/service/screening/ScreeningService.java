package com.flamingo.ai.resumescreener.service.screening;

import com.flamingo.ai.resumescreener.domain.model.JobDescriptionAnalysis;
import com.flamingo.ai.resumescreener.domain.model.ParsedProfile;
import com.flamingo.ai.resumescreener.domain.model.RequirementSet;
import com.flamingo.ai.resumescreener.domain.model.ScreenedCandidate;
import com.flamingo.ai.resumescreener.domain.model.SourceDocument;
import java.util.List;
import org.springframework.web.multipart.MultipartFile;

/** Service interface for candidate ingestion and screening. */
public interface ScreeningService {

  /**
   * Extracts and stores profiles for already-decoded documents.
   *
   * @param documents documents in upload order
   * @return stored profiles, in the same order
   */
  List<ParsedProfile> ingest(List<SourceDocument> documents);

  /**
   * Decodes uploaded files and ingests every supported one. Unsupported files are skipped.
   *
   * @param files uploaded files
   * @return stored profiles, in upload order
   * @throws com.flamingo.ai.resumescreener.exception.UnsupportedDocumentException if no file is
   *     supported
   * @throws com.flamingo.ai.resumescreener.exception.UploadLimitExceededException if the batch is
   *     too large
   */
  List<ParsedProfile> upload(List<MultipartFile> files);

  /**
   * Gets all stored profiles.
   *
   * @return profiles in insertion order
   */
  List<ParsedProfile> getCandidates();

  int countCandidates();

  /**
   * Scores every stored profile. Strict mode keeps only passing candidates; ranking mode keeps
   * all. Results are sorted by score, highest first, ties in insertion order.
   *
   * @param requirements screening criteria
   * @return screened candidates
   */
  List<ScreenedCandidate> filter(RequirementSet requirements);

  /**
   * Scores the given candidates side by side, in the order requested.
   *
   * @param ids candidate identifiers, duplicates collapsed
   * @param requirements screening criteria
   * @return screened candidates, unsorted and unfiltered
   * @throws com.flamingo.ai.resumescreener.exception.InsufficientCandidatesException if fewer than
   *     two distinct ids are requested or fewer than two are stored
   */
  List<ScreenedCandidate> compare(List<String> ids, RequirementSet requirements);

  /**
   * Removes every stored profile.
   *
   * @return the number of profiles removed
   */
  int clear();

  /**
   * Derives pre-filled requirements from a job description document.
   *
   * @param file uploaded JD document
   * @return the derived requirements and a preview of the decoded text
   */
  JobDescriptionAnalysis extractRequirements(MultipartFile file);

  /**
   * Scores and decides a single profile.
   *
   * @param profile candidate profile
   * @param requirements screening criteria
   * @return the profile with its decided match result
   */
  ScreenedCandidate screen(ParsedProfile profile, RequirementSet requirements);
}
