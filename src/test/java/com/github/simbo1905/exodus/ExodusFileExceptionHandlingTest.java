package com.github.simbo1905.exodus;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.*;

import java.io.IOException;
import java.util.logging.Level;
import org.junit.Test;

/// Injects I/O failures at chosen container calls and checks the state the file is left in.
public class ExodusFileExceptionHandlingTest extends JulLoggingConfig {

  static ExodusFileBuilder.Config config() {
    return new ExodusFileBuilder()
        .path("in-memory.e")
        .numDims(3)
        .numNodes(4)
        .numElems(2)
        .numBlocks(2)
        .numSideSets(1)
        .build();
  }

  /// Counts the container calls schema creation makes so failures can be placed after it.
  static int schemaOperations() throws IOException {
    final var counting = new DelegatingExceptionContainer(new InMemoryContainer(), -1);
    try (ExodusFile ignored = new ExodusFile(config(), counting)) {
      return counting.getOperationCount();
    }
  }

  @Test
  public void testFailureDuringCreationClosesContainer() throws IOException {
    final int total = schemaOperations();
    for (int target = 1; target <= total; target++) {
      final var memory = new InMemoryContainer();
      final var failing = new DelegatingExceptionContainer(memory, target);
      try (ExodusFile ignored = new ExodusFile(config(), failing)) {
        fail("Expected IOException at operation " + target);
      } catch (IOException e) {
        assertTrue(failing.didThrow());
        assertEquals("container closed after failure at " + target, 1, memory.closeCount);
      }
    }
  }

  @Test
  public void testCloseFailureDuringCreationKeepsOriginalException() {
    final var failing = new DelegatingExceptionContainer(new InMemoryContainer(), 1);
    failing.failOnClose = true;
    try (ExodusFile ignored = new ExodusFile(config(), failing)) {
      fail("Expected IOException");
    } catch (IOException e) {
      assertThat(e.getMessage(), containsString("operation 1"));
    }
  }

  @Test
  public void testIoFailureMovesToUnknown() throws IOException {
    final var memory = new InMemoryContainer();
    // fail on the first call after the schema is in place
    final var failing = new DelegatingExceptionContainer(memory, schemaOperations() + 1);
    final var exodus = new ExodusFile(config(), failing);
    assertEquals(ExodusFile.FileState.OPEN, exodus.getState());

    try {
      exodus.putElemBlkInfo(1, "QUAD4", 1, 4, 0);
      fail("Expected IOException");
    } catch (IOException e) {
      logger.log(Level.FINE, () -> "expected: " + e.getMessage());
    }
    assertEquals(ExodusFile.FileState.UNKNOWN, exodus.getState());

    try {
      exodus.putTime(1, 1.0);
      fail("Expected IllegalStateException");
    } catch (IllegalStateException e) {
      assertThat(e.getMessage(), containsString("UNKNOWN"));
    }

    exodus.close();
    assertEquals(ExodusFile.FileState.CLOSED, exodus.getState());
    assertTrue(memory.closed);
  }

  @Test
  public void testValidationFailureLeavesFileOpen() throws IOException {
    final var memory = new InMemoryContainer();
    try (ExodusFile exodus = new ExodusFile(config(), memory)) {
      try {
        exodus.putElemBlkInfo(1, "QUAD4", 3, 4, 0);
        fail("Expected ValidationException");
      } catch (ValidationException e) {
        assertEquals(ExodusFile.FileState.OPEN, exodus.getState());
      }
      try {
        exodus.putElemConnectivity(9, new int[] {1});
        fail("Expected EntityNotFoundException");
      } catch (EntityNotFoundException e) {
        assertEquals(ExodusFile.FileState.OPEN, exodus.getState());
      }
      exodus.putSideSetParams(1, 1, 0);
      try {
        exodus.putSideSetParams(2, 1, 0);
        fail("Expected CapacityExhaustedException");
      } catch (CapacityExhaustedException e) {
        assertEquals(ExodusFile.FileState.OPEN, exodus.getState());
      }
      exodus.putElemBlkInfo(1, "QUAD4", 2, 4, 0);
      exodus.putElemConnectivity(1, new int[] {1, 2, 3, 4, 2, 3, 4, 1});
      assertArrayEquals(new int[] {1, 2, 3, 4, 2, 3, 4, 1}, memory.readInts("connect1"));
    }
    assertEquals(1, memory.closeCount);
  }

  @Test
  public void testFailedCloseStillEndsClosed() throws IOException {
    final var failing = new DelegatingExceptionContainer(new InMemoryContainer(), -1);
    final var exodus = new ExodusFile(config(), failing);
    failing.failOnClose = true;
    try {
      exodus.close();
      fail("Expected IOException");
    } catch (IOException e) {
      assertEquals(ExodusFile.FileState.CLOSED, exodus.getState());
    }
    // second close is a no-op
    exodus.close();
  }
}
