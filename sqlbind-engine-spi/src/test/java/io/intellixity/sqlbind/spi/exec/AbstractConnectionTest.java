package io.intellixity.sqlbind.spi.exec;

import io.intellixity.sqlbind.driver.DriverInfos;
import io.intellixity.sqlbind.mult.Mult;
import io.intellixity.sqlbind.mult.UnexpectedRowCountException;
import io.intellixity.sqlbind.request.AtomicRequestIdAllocator;
import io.intellixity.sqlbind.request.Request;
import io.intellixity.sqlbind.request.Requests;
import io.intellixity.sqlbind.types.Tup2;
import io.intellixity.sqlbind.types.Types;
import io.intellixity.sqlbind.types.Unit;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

final class AbstractConnectionTest {
  private static final Requests REQUESTS = Requests.using(new AtomicRequestIdAllocator());

  private static final Request<Integer, String, Mult.One> NAME_BY_ID =
      REQUESTS.find(Types.int32(), Types.string(), "SELECT name FROM users WHERE id = ?");

  private static final class TestConnection extends AbstractConnection<FakeDriverConnection.Stmt> {
    TestConnection(FakeDriverConnection driver) {
      super(driver);
    }
  }

  private static List<Object> row(Object... values) {
    return List.of(values);
  }

  @Test
  void preparedRequest_isPreparedOncePerConnection() {
    FakeDriverConnection d = new FakeDriverConnection(DriverInfos.sqlite())
        .returning("SELECT name FROM users WHERE id = ?", List.of(row("ada")));
    try (TestConnection c = new TestConnection(d)) {
      for (int i = 0; i < 5; i++) assertEquals("ada", c.find(NAME_BY_ID, i));
      assertEquals(1, d.prepares.get());
      assertEquals(1, c.preparedCount());
    }
    assertTrue(d.statements.get(0).closed);
    assertTrue(d.closed);
  }

  @Test
  void concurrentFirstUse_preparesOnce() throws Exception {
    FakeDriverConnection d = new FakeDriverConnection(DriverInfos.sqlite())
        .returning("SELECT name FROM users WHERE id = ?", List.of(row("ada")));
    TestConnection c = new TestConnection(d);
    int threads = 8;
    CountDownLatch go = new CountDownLatch(1);
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    try {
      List<Future<String>> fs = new ArrayList<>();
      for (int t = 0; t < threads; t++) {
        int id = t;
        fs.add(pool.submit(() -> {
          go.await();
          return c.find(NAME_BY_ID, id);
        }));
      }
      go.countDown();
      for (Future<String> f : fs) assertEquals("ada", f.get());
    } finally {
      pool.shutdownNow();
      c.close();
    }
    assertEquals(1, d.prepares.get());
    assertEquals(threads, d.executions.size());
  }

  @Test
  void oneshotRequest_isNeverCached() {
    Request<Integer, String, Mult.One> q = REQUESTS.oneshot()
        .find(Types.int32(), Types.string(), "SELECT name FROM users WHERE id = ?");
    FakeDriverConnection d = new FakeDriverConnection(DriverInfos.sqlite())
        .returning("SELECT name FROM users WHERE id = ?", List.of(row("bob")));
    try (TestConnection c = new TestConnection(d)) {
      assertEquals("bob", c.find(q, 1));
      assertEquals("bob", c.find(q, 2));
      assertEquals(0, c.preparedCount());
      assertEquals(2, d.prepares.get());
      for (FakeDriverConnection.Stmt s : d.statements) assertTrue(s.closed);
    }
  }

  @Test
  void oneshotCloseFailure_doesNotHideExecutionFailure() {
    Request<Integer, String, Mult.One> q = REQUESTS.oneshot()
        .find(Types.int32(), Types.string(), "SELECT name FROM users WHERE id = ?");
    FakeDriverConnection d = new FakeDriverConnection(DriverInfos.sqlite());
    d.failHandleClose = true;
    TestConnection c = new TestConnection(d);
    UnexpectedRowCountException e = assertThrows(UnexpectedRowCountException.class, () -> c.find(q, 1));
    assertEquals(1, e.getSuppressed().length);
    assertTrue(e.getSuppressed()[0].getMessage().startsWith("close failed"));
  }

  @Test
  void requestsFromSeparateFactories_getTheirOwnStatements() {
    Request<Integer, String, Mult.One> name = Requests.using(new AtomicRequestIdAllocator())
        .find(Types.int32(), Types.string(), "SELECT name FROM users WHERE id = ?");
    Request<Integer, String, Mult.One> email = Requests.using(new AtomicRequestIdAllocator())
        .find(Types.int32(), Types.string(), "SELECT email FROM users WHERE id = ?");
    assertEquals(name.id(), email.id());

    FakeDriverConnection d = new FakeDriverConnection(DriverInfos.sqlite())
        .returning("SELECT name FROM users WHERE id = ?", List.of(row("ada")))
        .returning("SELECT email FROM users WHERE id = ?", List.of(row("ada@example.org")));
    try (TestConnection c = new TestConnection(d)) {
      assertEquals("ada", c.find(name, 1));
      assertEquals("ada@example.org", c.find(email, 1));
      assertEquals("ada", c.find(name, 1));
      assertEquals(2, d.prepares.get());
      assertEquals(2, c.preparedCount());

      c.deallocate(email);
      assertEquals(1, c.preparedCount());
      assertEquals("ada", c.find(name, 1));
      assertEquals(2, d.prepares.get());
    }
  }

  @Test
  void repeatedParameters_areDuplicatedForLinearBackend() {
    Request<Tup2<Integer, String>, Unit, Mult.Zero> r = REQUESTS.exec(
        Types.tup2(Types.int32(), Types.string()), "UPDATE t SET a = $2, b = $2 WHERE id = $1");
    FakeDriverConnection d = new FakeDriverConnection(DriverInfos.mariadb());
    try (TestConnection c = new TestConnection(d)) {
      c.exec(r, new Tup2<>(7, "x"));
    }
    assertEquals("UPDATE t SET a = ?, b = ? WHERE id = ?", d.statements.get(0).sql);
    assertEquals(List.of("x", "x", 7), d.executions.get(0));
  }

  @Test
  void indexedBackend_receivesValuesInIndexOrder() {
    Request<Tup2<Integer, String>, Unit, Mult.Zero> r = REQUESTS.exec(
        Types.tup2(Types.int32(), Types.string()), "UPDATE t SET a = $2, b = $2 WHERE id = $1");
    FakeDriverConnection d = new FakeDriverConnection(DriverInfos.postgresql());
    try (TestConnection c = new TestConnection(d)) {
      assertEquals(3, c.execAffected(r, new Tup2<>(7, "x")));
    }
    assertEquals("UPDATE t SET a = $2, b = $2 WHERE id = $1", d.statements.get(0).sql);
    assertEquals(List.of(7, "x"), d.executions.get(0));
  }

  @Test
  void find_requiresExactlyOneRow() {
    FakeDriverConnection none = new FakeDriverConnection(DriverInfos.sqlite());
    try (TestConnection c = new TestConnection(none)) {
      UnexpectedRowCountException e = assertThrows(UnexpectedRowCountException.class, () -> c.find(NAME_BY_ID, 1));
      assertEquals(0, e.observed());
      assertSame(Mult.ONE, e.expected());
    }

    FakeDriverConnection many = new FakeDriverConnection(DriverInfos.sqlite())
        .returning("SELECT name FROM users WHERE id = ?", List.of(row("a"), row("b"), row("c")));
    try (TestConnection c = new TestConnection(many)) {
      UnexpectedRowCountException e = assertThrows(UnexpectedRowCountException.class, () -> c.find(NAME_BY_ID, 1));
      assertEquals(2, e.observed());
      assertEquals(2, many.rowsRead.get());
    }
  }

  @Test
  void findOpt_allowsZeroOrOne() {
    Request<Integer, String, Mult.ZeroOrOne> r =
        REQUESTS.findOpt(Types.int32(), Types.string(), "SELECT name FROM users WHERE id = ?");
    try (TestConnection c = new TestConnection(new FakeDriverConnection(DriverInfos.sqlite()))) {
      assertEquals(Optional.empty(), c.findOpt(r, 1));
    }
    try (TestConnection c = new TestConnection(new FakeDriverConnection(DriverInfos.sqlite())
        .returning("SELECT name FROM users WHERE id = ?", List.of(row("x"))))) {
      assertEquals(Optional.of("x"), c.findOpt(r, 1));
      assertEquals(Optional.of("x"), c.findOpt(NAME_BY_ID, 1));
    }
    try (TestConnection c = new TestConnection(new FakeDriverConnection(DriverInfos.sqlite())
        .returning("SELECT name FROM users WHERE id = ?", List.of(row("x"), row("y"))))) {
      assertThrows(UnexpectedRowCountException.class, () -> c.findOpt(r, 1));
    }
  }

  @Test
  void exec_rejectsReturnedRows() {
    Request<Unit, Unit, Mult.Zero> r = REQUESTS.exec(Types.unit(), "SELECT 1");
    try (TestConnection c = new TestConnection(new FakeDriverConnection(DriverInfos.sqlite())
        .returning("SELECT 1", List.of(row(1))))) {
      UnexpectedRowCountException e = assertThrows(UnexpectedRowCountException.class, () -> c.exec(r, Unit.UNIT));
      assertSame(Mult.ZERO, e.expected());
      assertEquals(1, e.observed());
    }
  }

  @Test
  void collectFoldAndIter_seeAllRowsInOrder() {
    Request<Unit, Tup2<Integer, String>, Mult.Many> r = REQUESTS.collect(
        Types.unit(), Types.tup2(Types.int32(), Types.string()), "SELECT id, name FROM users ORDER BY id");
    FakeDriverConnection d = new FakeDriverConnection(DriverInfos.sqlite())
        .returning("SELECT id, name FROM users ORDER BY id", List.of(row(1, "a"), row(2, "b"), row(3, "c")));
    try (TestConnection c = new TestConnection(d)) {
      assertEquals(List.of(new Tup2<>(1, "a"), new Tup2<>(2, "b"), new Tup2<>(3, "c")), c.collect(r, Unit.UNIT));
      assertEquals("abc", c.fold(r, Unit.UNIT, "", (acc, t) -> acc + t.second()));
      List<Integer> ids = new ArrayList<>();
      c.iter(r, Unit.UNIT, t -> ids.add(t.first()));
      assertEquals(List.of(1, 2, 3), ids);
      assertEquals(1, d.prepares.get());
    }
  }

  @Test
  void declaredMultiplicity_isAlsoEnforced() {
    FakeDriverConnection d = new FakeDriverConnection(DriverInfos.sqlite())
        .returning("SELECT name FROM users WHERE id = ?", List.of(row("a"), row("b")));
    try (TestConnection c = new TestConnection(d)) {
      UnexpectedRowCountException e = assertThrows(UnexpectedRowCountException.class, () -> c.collect(NAME_BY_ID, 1));
      assertSame(Mult.ONE, e.expected());
    }
  }

  @Test
  void deallocate_closesHandleAndAllowsRePrepare() {
    FakeDriverConnection d = new FakeDriverConnection(DriverInfos.sqlite())
        .returning("SELECT name FROM users WHERE id = ?", List.of(row("ada")));
    try (TestConnection c = new TestConnection(d)) {
      c.find(NAME_BY_ID, 1);
      c.deallocate(NAME_BY_ID);
      assertEquals(0, c.preparedCount());
      assertTrue(d.statements.get(0).closed);
      c.find(NAME_BY_ID, 1);
      assertEquals(2, d.prepares.get());
    }
  }

  @Test
  void closedConnection_rejectsExecution() {
    TestConnection c = new TestConnection(new FakeDriverConnection(DriverInfos.sqlite()));
    c.close();
    c.close();
    assertTrue(c.isClosed());
    assertThrows(IllegalStateException.class, () -> c.find(NAME_BY_ID, 1));
  }
}
