package com.github.simbo1905.exodus;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Builder for new Exodus files.
///
/// Example usage:
/// <pre>
/// try (ExodusFile exodus = new ExodusFileBuilder()
///     .path("/path/to/mesh.e")
///     .title("tet mesh")
///     .numDims(3)
///     .numNodes(4)
///     .numElems(1)
///     .numBlocks(1)
///     .create()) {
///   exodus.putElemBlkInfo(100, "TETRA", 1, 4, 0);
///   exodus.putElemConnectivity(100, new int[] {1, 2, 3, 4});
/// }
/// </pre>
public class ExodusFileBuilder {

  private static final Logger logger = Logger.getLogger(ExodusFileBuilder.class.getName());

  /// How the file is opened. Only writing a new file is implemented.
  public enum AccessMode {
    READ("r"),
    APPEND("a"),
    WRITE("w");

    final String mode;

    AccessMode(String mode) {
      this.mode = mode;
    }

    public String getMode() {
      return mode;
    }
  }

  /// Default bytes of header space reserved for blocks, side sets and variables added after
  /// creation. Each addition that does not fit forces netCDF to rewrite the whole file.
  public static final int DEFAULT_EXTRA_HEADER_SPACE = 64 * 1024;

  private Path path;
  private String title = "";
  private int numDims;
  private int numNodes;
  private int numElems;
  private int numBlocks;
  private int numNodeSets;
  private int numSideSets;
  private int ioSize;
  private AccessMode accessMode = AccessMode.WRITE;
  private boolean largeFile = true;
  private int extraHeaderSpace = DEFAULT_EXTRA_HEADER_SPACE;
  /// Null until set, then [#build()] falls back to [ExodusFile#getChunkSizeMbOrDefault()].
  private Integer connectivityChunkSizeMb;

  /// Sets the path of the file to create. The file must not exist yet.
  ///
  /// @param path the path of the new file
  /// @return this builder for chaining
  public ExodusFileBuilder path(Path path) {
    this.path = path;
    return this;
  }

  /// Sets the path of the file to create using a string.
  ///
  /// @param path the path string of the new file
  /// @return this builder for chaining
  public ExodusFileBuilder path(String path) {
    this.path = Paths.get(path).normalize();
    return this;
  }

  /// Sets the title of the mesh, at most 80 bytes.
  ///
  /// @param title the title
  /// @return this builder for chaining
  public ExodusFileBuilder title(String title) {
    this.title = title == null ? "" : title;
    return this;
  }

  /// Sets the number of spatial dimensions, 2 or 3.
  ///
  /// @param numDims the number of spatial dimensions
  /// @return this builder for chaining
  public ExodusFileBuilder numDims(int numDims) {
    this.numDims = numDims;
    return this;
  }

  public ExodusFileBuilder numNodes(int numNodes) {
    this.numNodes = numNodes;
    return this;
  }

  public ExodusFileBuilder numElems(int numElems) {
    this.numElems = numElems;
    return this;
  }

  /// Sets how many element blocks the file can hold. This capacity is fixed once created.
  ///
  /// @param numBlocks the element block capacity
  /// @return this builder for chaining
  public ExodusFileBuilder numBlocks(int numBlocks) {
    this.numBlocks = numBlocks;
    return this;
  }

  /// Node sets are not supported so anything other than zero is rejected by [#create()].
  ///
  /// @param numNodeSets the number of node sets
  /// @return this builder for chaining
  public ExodusFileBuilder numNodeSets(int numNodeSets) {
    this.numNodeSets = numNodeSets;
    return this;
  }

  /// Sets how many side sets the file can hold. Zero leaves the side set arrays out entirely.
  ///
  /// @param numSideSets the side set capacity
  /// @return this builder for chaining
  public ExodusFileBuilder numSideSets(int numSideSets) {
    this.numSideSets = numSideSets;
    return this;
  }

  /// Sets the floating point precision of the file: 0 for the machine word size, 4 for single
  /// and 8 for double precision.
  ///
  /// @param ioSize 0, 4 or 8
  /// @return this builder for chaining
  public ExodusFileBuilder ioSize(int ioSize) {
    this.ioSize = ioSize;
    return this;
  }

  public ExodusFileBuilder accessMode(AccessMode accessMode) {
    this.accessMode = accessMode;
    return this;
  }

  /// Selects the 64-bit offset netCDF variant, needed once a file passes 2 GiB. On by default.
  ///
  /// @param largeFile true for 64-bit offsets
  /// @return this builder for chaining
  public ExodusFileBuilder largeFile(boolean largeFile) {
    this.largeFile = largeFile;
    return this;
  }

  /// Sets the bytes of header space reserved for schema added after creation.
  ///
  /// @param bytes the reserved header space
  /// @return this builder for chaining
  public ExodusFileBuilder extraHeaderSpace(int bytes) {
    if (bytes < 0) {
      throw new IllegalArgumentException("extraHeaderSpace must be non-negative, got " + bytes);
    }
    this.extraHeaderSpace = bytes;
    return this;
  }

  /// Sets the chunk size in MiB used when connectivity is written with an index shift. This is
  /// also the most extra memory such a write needs.
  ///
  /// @param chunkSizeMb the chunk size in MiB
  /// @return this builder for chaining
  public ExodusFileBuilder connectivityChunkSize(int chunkSizeMb) {
    if (chunkSizeMb <= 0) {
      throw new IllegalArgumentException(
          "connectivityChunkSize must be positive, got " + chunkSizeMb);
    }
    this.connectivityChunkSizeMb = chunkSizeMb;
    return this;
  }

  /// Creation parameters after validation.
  record Config(
      Path path,
      String title,
      int numDims,
      int numNodes,
      int numElems,
      int numBlocks,
      int numSideSets,
      WordSize wordSize,
      boolean largeFile,
      int extraHeaderSpace,
      long connectivityChunkBytes) {}

  /// Validates the settings without touching the disk.
  ///
  /// @throws ValidationException if any setting is outside what the writer supports
  Config build() {
    if (accessMode != AccessMode.WRITE) {
      throw new ValidationException(
          "Only writing a new file is supported, got mode '" + accessMode.getMode() + "'");
    }
    if (path == null) {
      throw new IllegalStateException("path must be specified");
    }
    if (numDims != 2 && numDims != 3) {
      throw new ValidationException("Only 2 or 3 dimensions are supported, got " + numDims);
    }
    if (numNodeSets != 0) {
      throw new ValidationException("Node sets are not supported, numNodeSets must be 0");
    }
    requirePositive("numNodes", numNodes);
    requirePositive("numElems", numElems);
    requirePositive("numBlocks", numBlocks);
    if (numSideSets < 0) {
      throw new ValidationException("numSideSets must be non-negative, got " + numSideSets);
    }
    final int titleBytes = title.getBytes(StandardCharsets.UTF_8).length;
    if (titleBytes >= ExodusSchema.LEN_LINE) {
      throw new ValidationException(
          String.format(
              "Title is %d bytes but must be shorter than %d", titleBytes, ExodusSchema.LEN_LINE));
    }
    final var wordSize = WordSize.fromIoSize(ioSize);
    final int chunkSizeMb =
        connectivityChunkSizeMb != null
            ? connectivityChunkSizeMb
            : ExodusFile.getChunkSizeMbOrDefault();

    final var config =
        new Config(
            path,
            title,
            numDims,
            numNodes,
            numElems,
            numBlocks,
            numSideSets,
            wordSize,
            largeFile,
            extraHeaderSpace,
            chunkSizeMb * 1024L * 1024L);
    logger.log(Level.FINE, () -> "Resolved " + config);
    return config;
  }

  private static void requirePositive(String name, int value) {
    if (value < 1) {
      throw new ValidationException(name + " must be positive, got " + value);
    }
  }

  /// Creates the file and writes the empty Exodus schema into it.
  ///
  /// The path is claimed with an atomic create before netCDF opens it, so two writers racing
  /// for the same path cannot both succeed. If the schema cannot be written the claimed file is
  /// removed again.
  ///
  /// @return the open file, which the caller must close
  /// @throws ValidationException if the settings are invalid or the file already exists
  /// @throws IOException if the file cannot be created
  public ExodusFile create() throws IOException {
    final var config = build();
    try {
      Files.createFile(config.path());
    } catch (FileAlreadyExistsException e) {
      throw new ValidationException("File '" + config.path() + "' already exists", e);
    }
    try {
      return new ExodusFile(config);
    } catch (IOException | RuntimeException e) {
      try {
        Files.deleteIfExists(config.path());
      } catch (IOException deleteException) {
        logger.log(
            Level.WARNING,
            "Failed to remove " + config.path() + " after a failed create",
            deleteException);
      }
      throw e;
    }
  }
}
