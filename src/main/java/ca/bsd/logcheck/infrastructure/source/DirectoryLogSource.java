package ca.bsd.logcheck.infrastructure.source;

import ca.bsd.logcheck.application.ingest.IngestException;
import ca.bsd.logcheck.application.port.LogSource;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link LogSource} listing the log files of one folder.
 * <p><strong>Role:</strong> Adapter feeding {@link ca.bsd.logcheck.application.ingest.LogIngestor}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Select regular files matching a glob such as {@code *.txt}; subfolders are not descended.</li>
 *   <li>Order files by name so repeated runs see the same sequence.</li>
 *   <li>Decode file contents with the configured charset.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; each {@link LogFile#open()} returns a new reader.</p>
 *
 * @since 0.1.0
 */
public final class DirectoryLogSource implements LogSource {
  private static final Logger log = LoggerFactory.getLogger(DirectoryLogSource.class);

  private final Path directory;
  private final String glob;
  private final Charset charset;

  /**
   * Creates a source over {@code directory}.
   *
   * @param directory folder holding log files
   * @param glob file name glob, e.g. {@code *.txt}
   * @param charset charset used to decode files
   */
  public DirectoryLogSource(Path directory, String glob, Charset charset) {
    this.directory = Objects.requireNonNull(directory, "directory");
    this.glob = Objects.requireNonNull(glob, "glob");
    this.charset = Objects.requireNonNull(charset, "charset");
  }

  @Override
  public String description() {
    return directory.resolve(glob).toString();
  }

  /**
   * Lists matching files sorted by file name.
   *
   * @return non-empty list of files
   * @throws IngestException if the folder is missing, is not a directory, cannot be listed, or holds no match
   */
  @Override
  public List<LogFile> files() throws IngestException {
    if (!Files.exists(directory)) {
      throw new IngestException("The folder " + directory + " does not exist");
    }
    if (!Files.isDirectory(directory)) {
      throw new IngestException(directory + " is not a directory");
    }
    List<Path> matches = new ArrayList<>();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, glob)) {
      for (Path path : stream) {
        if (Files.isRegularFile(path)) {
          matches.add(path);
        } else {
          log.debug("Skipping non-regular entry {}", path);
        }
      }
    } catch (IOException ex) {
      throw new IngestException("Unable to list " + directory + ": " + ex.getMessage(), ex);
    }
    if (matches.isEmpty()) {
      throw new IngestException("No files matching '" + glob + "' found in " + directory);
    }
    matches.sort(Comparator.comparing(path -> path.getFileName().toString()));
    List<LogFile> files = new ArrayList<>(matches.size());
    for (Path path : matches) {
      files.add(new PathLogFile(path, charset));
    }
    return List.copyOf(files);
  }

  private record PathLogFile(Path path, Charset charset) implements LogFile {
    @Override
    public String name() {
      return path.getFileName().toString();
    }

    @Override
    public BufferedReader open() throws IOException {
      return Files.newBufferedReader(path, charset);
    }
  }
}
