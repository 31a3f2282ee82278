package com.flamingo.ai.resumescreener.service.store;

import com.flamingo.ai.resumescreener.domain.model.ParsedProfile;
import java.util.Collection;
import java.util.List;

/** Process-wide registry of parsed candidate profiles keyed by identifier. */
public interface CandidateStore {

  /**
   * Inserts a profile.
   *
   * @param profile the profile to store
   * @return the profile identifier
   * @throws com.flamingo.ai.resumescreener.exception.DuplicateIdentifierException if a profile
   *     with the same identifier is already stored
   */
  String add(ParsedProfile profile);

  /**
   * Looks up profiles by identifier.
   *
   * @param ids identifiers in the order they should be returned
   * @return the stored profiles in requested order, unknown identifiers omitted
   */
  List<ParsedProfile> getByIds(Collection<String> ids);

  /**
   * Returns a snapshot of all profiles in insertion order.
   *
   * @return the stored profiles
   */
  List<ParsedProfile> all();

  int size();

  /**
   * Removes every stored profile.
   *
   * @return the number of profiles removed
   */
  int clear();
}
