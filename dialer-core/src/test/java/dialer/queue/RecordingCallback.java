package dialer.queue;

import dialer.DialCallback;
import dialer.DialException;
import dialer.DialResult;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

class RecordingCallback implements DialCallback {
  final List<DialResult> results = new CopyOnWriteArrayList<>();

  @Override
  public void onResult(DialResult result) {
    results.add(result);
  }

  DialResult single() {
    if (results.size() != 1) {
      throw new AssertionError("Expected exactly one result, got " + results);
    }
    return results.get(0);
  }

  DialException.Code failureCode() {
    DialResult result = single();
    if (!(result instanceof DialResult.Failed failed)) {
      throw new AssertionError("Expected a failure, got " + result);
    }
    return failed.code();
  }
}
