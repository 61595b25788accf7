package com.notisync.device.service;

import com.notisync.device.model.NotificationRecord;
import com.notisync.device.repository.LocalRecordStore;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationQueryService {

  static final int MAX_PAGE_SIZE = 200;

  private final LocalRecordStore store;

  public NotificationRecord get(String recordId) {
    return store.getRecord(recordId).orElseThrow(() -> new RecordNotFoundException(recordId));
  }

  /** Newest first. */
  public List<NotificationRecord> list(int limit, int offset) {
    if (limit <= 0 || offset < 0) {
      throw new IllegalArgumentException("limit must be positive and offset non-negative");
    }
    return store.listRecords(Math.min(limit, MAX_PAGE_SIZE), offset);
  }
}
