package dialer.queue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Executor that only runs tasks when told to, standing in for "the next tick".
 */
class ManualExecutor implements Executor {
  private final List<Runnable> tasks = new ArrayList<>();

  @Override
  public void execute(Runnable command) {
    tasks.add(command);
  }

  int pending() {
    return tasks.size();
  }

  void runAll() {
    while (!tasks.isEmpty()) {
      List<Runnable> batch = new ArrayList<>(tasks);
      tasks.clear();
      batch.forEach(Runnable::run);
    }
  }
}
