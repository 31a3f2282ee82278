package com.flamingo.ai.resumescreener.service.store;

import com.flamingo.ai.resumescreener.domain.model.ParsedProfile;
import com.flamingo.ai.resumescreener.exception.DuplicateIdentifierException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@link CandidateStore} kept in process memory.
 *
 * <p>Writers hold the write lock, so readers never observe a half-applied insert or clear.
 * Returned lists are copies and stay valid after later mutations.
 */
@Component
@Slf4j
public class InMemoryCandidateStore implements CandidateStore {

  private final Map<String, ParsedProfile> profiles = new LinkedHashMap<>();
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  @Override
  public String add(ParsedProfile profile) {
    lock.writeLock().lock();
    try {
      if (profiles.containsKey(profile.id())) {
        throw new DuplicateIdentifierException(profile.id());
      }
      profiles.put(profile.id(), profile);
      log.debug("Stored candidate {} ({})", profile.id(), profile.filename());
      return profile.id();
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public List<ParsedProfile> getByIds(Collection<String> ids) {
    lock.readLock().lock();
    try {
      List<ParsedProfile> result = new ArrayList<>();
      for (String id : ids) {
        ParsedProfile profile = profiles.get(id);
        if (profile != null) {
          result.add(profile);
        }
      }
      return result;
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public List<ParsedProfile> all() {
    lock.readLock().lock();
    try {
      return new ArrayList<>(profiles.values());
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public int size() {
    lock.readLock().lock();
    try {
      return profiles.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public int clear() {
    lock.writeLock().lock();
    try {
      int removed = profiles.size();
      profiles.clear();
      return removed;
    } finally {
      lock.writeLock().unlock();
    }
  }
}
