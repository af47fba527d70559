package io.github.panghy.tokengraph.storage;

import static java.util.concurrent.CompletableFuture.completedFuture;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.apple.foundationdb.tuple.Tuple;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StorageScansTest {
  private static final Executor DIRECT = Runnable::run;
  private static final byte[] PREFIX = Tuple.from("scan").pack();
  private static final Function<byte[], Object> GROUP = key -> Tuple.fromBytes(key).getLong(1);

  private RecordingStorageBackend backend;

  @BeforeEach
  void setUp() {
    backend = new RecordingStorageBackend(new InMemoryStorageBackend());
    backend.<Void>runAsync(tx -> {
      tx.set(Tuple.from("other").pack(), new byte[] {1});
      return completedFuture(null);
    }).join();
  }

  @Test
  void pagesResumeAfterTheLastKeyInSeparateTransactions() {
    write(5, 5);
    List<List<Long>> pages = new ArrayList<>();

    StorageScans.forEachPage(backend, PREFIX, 10, DIRECT, page -> {
      pages.add(items(page));
      return true;
    }).join();

    assertThat(pages).extracting(List::size).containsExactly(10, 10, 5);
    assertThat(pages.stream().flatMap(List::stream)).containsExactlyElementsOf(sequence(25));
    assertThat(backend.readTransactions()).isEqualTo(3);
    assertThat(backend.largestRead()).isEqualTo(10);
  }

  @Test
  void exactMultipleEndsWithoutAnEmptyPage() {
    write(4, 5);
    List<Integer> sizes = new ArrayList<>();

    StorageScans.forEachPage(backend, PREFIX, 10, DIRECT, page -> sizes.add(page.size())).join();

    assertThat(sizes).containsExactly(10, 10);
  }

  @Test
  void groupsAreNeverSplitAcrossPages() {
    write(5, 3);
    List<List<StoredEntry>> pages = new ArrayList<>();

    StorageScans.forEachPage(backend, PREFIX, 5, GROUP, DIRECT, pages::add).join();

    assertThat(pages).hasSize(5);
    for (List<StoredEntry> page : pages) {
      assertThat(page).extracting(e -> GROUP.apply(e.key())).containsOnly(GROUP.apply(page.get(0).key()));
      assertThat(page).hasSize(3);
    }
  }

  @Test
  void consumerCanStopTheScan() {
    write(5, 5);
    List<Integer> sizes = new ArrayList<>();

    StorageScans.forEachPage(backend, PREFIX, 4, DIRECT, page -> {
      sizes.add(page.size());
      return false;
    }).join();

    assertThat(sizes).containsExactly(4);
    assertThat(backend.readTransactions()).isEqualTo(1);
  }

  @Test
  void emptyPrefixCompletesWithoutCallingTheConsumer() {
    List<Integer> sizes = new ArrayList<>();

    StorageScans.forEachPage(backend, Tuple.from("missing").pack(), 4, DIRECT, page -> sizes.add(page.size()))
        .join();

    assertThat(sizes).isEmpty();
  }

  @Test
  void groupLargerThanAPageFails() {
    write(1, 6);

    assertThatThrownBy(() -> StorageScans.forEachPage(backend, PREFIX, 5, GROUP, DIRECT, page -> true).join())
        .hasCauseInstanceOf(IllegalStateException.class);
  }

  @Test
  void pageSizeMustBePositive() {
    assertThatThrownBy(() -> StorageScans.forEachPage(backend, PREFIX, 0, DIRECT, page -> true))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private void write(int groups, int perGroup) {
    backend.<Void>runAsync(tx -> {
      for (long g = 0; g < groups; g++) {
        for (long i = 0; i < perGroup; i++) {
          tx.set(Tuple.from("scan", g, i).pack(), Tuple.from(g * perGroup + i).pack());
        }
      }
      return completedFuture(null);
    }).join();
  }

  private static List<Long> items(List<StoredEntry> page) {
    List<Long> items = new ArrayList<>();
    for (StoredEntry e : page) items.add(Tuple.fromBytes(e.value()).getLong(0));
    return items;
  }

  private static List<Long> sequence(int n) {
    List<Long> values = new ArrayList<>();
    for (long i = 0; i < n; i++) values.add(i);
    return values;
  }
}
