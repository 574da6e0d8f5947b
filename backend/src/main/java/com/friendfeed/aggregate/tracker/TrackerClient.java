package com.friendfeed.aggregate.tracker;

import com.friendfeed.aggregate.model.TrackerEntry;

import java.util.List;

public interface TrackerClient {
  /**
   * All open entries, newest first, minus those carrying any of {@code excludeLabels}.
   *
   * @throws TrackerAccessException when the listing cannot be completed
   */
  List<TrackerEntry> listOpenEntries(List<String> excludeLabels);

  boolean updateEntryBody(long entryNumber, String body);
}
