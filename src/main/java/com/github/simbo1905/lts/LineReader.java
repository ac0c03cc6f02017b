package com.github.simbo1905.lts;

import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.channels.ReadableByteChannel;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Decodes a byte channel into lines, one buffer at a time, remembering which terminator ended
/// each line so that multi-line text can be written back with the same line breaks.
///
/// Multi-byte characters and `\r\n` pairs may straddle buffer boundaries. Undecodable input is
/// reported as a [java.nio.charset.CharacterCodingException] rather than replaced.
///
/// Besides [#readLine()] the reader offers raw byte access ([#readByte()], [#readBytes(int)],
/// [#readRawLine()]) for callers that seek to a known offset and scan the bytes themselves. Raw
/// access is only legal when no decoded characters are waiting to be consumed, which is always
/// the case straight after [#seek(long)].
///
/// Not thread safe. Forward only unless the channel is seekable.
public class LineReader implements Closeable {

  private static final Logger logger = Logger.getLogger(LineReader.class.getName());

  /// Default number of bytes read from the channel at a time.
  public static final int DEFAULT_BUFFER_SIZE = 1024;

  /// Smallest buffer that can always hold one complete encoded character.
  static final int MIN_BUFFER_SIZE = 8;

  private final ReadableByteChannel channel;
  private final CharsetDecoder decoder;
  private final CharsetDecoder rawDecoder;
  private final ByteBuffer bytes;
  private final CharBuffer chars;

  private boolean endOfInput;
  private boolean flushed;
  private LineEnding previousLineEnding;
  private LineEnding currentLineEnding;

  public LineReader(ReadableByteChannel channel, Charset charset) {
    this(channel, charset, DEFAULT_BUFFER_SIZE);
  }

  public LineReader(ReadableByteChannel channel, Charset charset, int bufferSize) {
    if (bufferSize < MIN_BUFFER_SIZE) {
      throw new IllegalArgumentException(
          "bufferSize must be at least " + MIN_BUFFER_SIZE + ", got " + bufferSize);
    }
    this.channel = channel;
    this.decoder = strictDecoder(charset);
    this.rawDecoder = strictDecoder(charset);
    this.bytes = ByteBuffer.allocate(bufferSize);
    this.bytes.flip();
    this.chars = CharBuffer.allocate((int) Math.ceil(bufferSize * (double) decoder.maxCharsPerByte()));
    this.chars.flip();
  }

  private static CharsetDecoder strictDecoder(Charset charset) {
    return charset
        .newDecoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT);
  }

  /// The terminator of the line most recently returned by [#readLine()], or null if that line
  /// ran to the end of the input or no line has been read yet.
  public LineEnding currentLineEnding() {
    return currentLineEnding;
  }

  /// The terminator of the line read before the current one, or null if there was none.
  public LineEnding previousLineEnding() {
    return previousLineEnding;
  }

  /// The terminator that separated the previous line from the current one. This is what joins a
  /// continuation line onto the text of the entry that precedes it. Defaults to [LineEnding#LF]
  /// when fewer than two lines have been read.
  public LineEnding separatorEnding() {
    if (previousLineEnding != null) {
      return previousLineEnding;
    }
    return currentLineEnding != null ? currentLineEnding : LineEnding.LF;
  }

  /// Reads the next line without its terminator.
  ///
  /// @return the line, or null at the end of the input
  /// @throws java.nio.charset.CharacterCodingException if the bytes cannot be decoded
  public String readLine() throws IOException {
    if (!chars.hasRemaining() && fillChars() == 0) {
      return null;
    }
    StringBuilder sb = null;
    do {
      final int start = chars.position();
      final int limit = chars.limit();
      final char[] array = chars.array();
      for (int i = start; i < limit; i++) {
        final char ch = array[i];
        if (ch == '\r' || ch == '\n') {
          final String line;
          if (sb != null) {
            sb.append(array, start, i - start);
            line = sb.toString();
          } else {
            line = new String(array, start, i - start);
          }
          chars.position(i + 1);
          if (ch == '\r') {
            if ((chars.hasRemaining() || fillChars() > 0) && chars.get(chars.position()) == '\n') {
              chars.position(chars.position() + 1);
              shiftLineEnding(LineEnding.CRLF);
            } else {
              shiftLineEnding(LineEnding.CR);
            }
          } else {
            shiftLineEnding(LineEnding.LF);
          }
          return line;
        }
      }
      if (sb == null) {
        sb = new StringBuilder(limit - start + 80);
      }
      sb.append(array, start, limit - start);
      chars.position(limit);
    } while (fillChars() > 0);

    shiftLineEnding(null);
    return sb.toString();
  }

  /// Reads one raw byte.
  ///
  /// @return the byte as an unsigned value, or -1 at the end of the input
  /// @throws IllegalStateException if decoded characters are pending
  public int readByte() throws IOException {
    ensureNoPendingChars();
    if (!bytes.hasRemaining()) {
      bytes.clear();
      final int n = channel.read(bytes);
      bytes.flip();
      if (n < 0) {
        return -1;
      }
      if (n == 0) {
        return readByte();
      }
    }
    return bytes.get() & 0xFF;
  }

  /// Reads exactly `count` raw bytes and decodes them.
  ///
  /// @throws EOFException if the input ends first
  /// @throws java.nio.charset.CharacterCodingException if the bytes cannot be decoded
  public String readBytes(int count) throws IOException {
    ensureNoPendingChars();
    final byte[] buffer = new byte[count];
    int filled = 0;
    while (filled < count) {
      if (!bytes.hasRemaining()) {
        bytes.clear();
        final int n = channel.read(bytes);
        bytes.flip();
        if (n < 0) {
          throw new EOFException(
              String.format("expected %d bytes but the input ended after %d", count, filled));
        }
      }
      final int take = Math.min(bytes.remaining(), count - filled);
      bytes.get(buffer, filled, take);
      filled += take;
    }
    return decodeRaw(buffer, count);
  }

  /// Reads raw bytes up to the next `\r` or `\n` (consumed, not returned) or the end of the
  /// input, and decodes them.
  ///
  /// @throws java.nio.charset.CharacterCodingException if the bytes cannot be decoded
  public String readRawLine() throws IOException {
    final ByteArrayOutputStream out = new ByteArrayOutputStream(80);
    int b;
    while ((b = readByte()) != -1 && b != '\r' && b != '\n') {
      out.write(b);
    }
    final byte[] raw = out.toByteArray();
    return decodeRaw(raw, raw.length);
  }

  /// Moves to an absolute byte position, discarding buffered input and line ending history.
  ///
  /// @throws UnsupportedOperationException if the channel is not seekable
  public void seek(long position) throws IOException {
    logger.log(Level.FINEST, () -> String.format("seek %d", position));
    seekable("seek").position(position);
    bytes.clear();
    bytes.flip();
    chars.clear();
    chars.flip();
    decoder.reset();
    endOfInput = false;
    flushed = false;
    previousLineEnding = null;
    currentLineEnding = null;
  }

  /// The size in bytes of the underlying input.
  ///
  /// @throws UnsupportedOperationException if the channel is not seekable
  public long size() throws IOException {
    return seekable("size").size();
  }

  private SeekableByteChannel seekable(String operation) {
    if (!(channel instanceof SeekableByteChannel seekable)) {
      throw new UnsupportedOperationException(
          operation + " requires a SeekableByteChannel, got " + channel.getClass().getName());
    }
    return seekable;
  }

  @Override
  public void close() throws IOException {
    channel.close();
  }

  private void shiftLineEnding(LineEnding ending) {
    previousLineEnding = currentLineEnding;
    currentLineEnding = ending;
  }

  private void ensureNoPendingChars() {
    if (chars.hasRemaining()) {
      throw new IllegalStateException(
          "raw byte access while " + chars.remaining() + " decoded chars are pending");
    }
  }

  private String decodeRaw(byte[] raw, int length) throws IOException {
    rawDecoder.reset();
    return rawDecoder.decode(ByteBuffer.wrap(raw, 0, length)).toString();
  }

  /// Refills the character buffer. Any chars not yet consumed are discarded, so callers only
  /// refill once the buffer is drained.
  ///
  /// @return the number of chars now available, zero at the end of the input
  private int fillChars() throws IOException {
    chars.clear();
    while (chars.position() == 0 && !flushed) {
      if (!endOfInput) {
        bytes.compact();
        final int n = channel.read(bytes);
        bytes.flip();
        if (n < 0) {
          endOfInput = true;
        }
      }
      CoderResult result = decoder.decode(bytes, chars, endOfInput);
      if (result.isError()) {
        result.throwException();
      }
      if (endOfInput && result.isUnderflow()) {
        result = decoder.flush(chars);
        if (result.isError()) {
          result.throwException();
        }
        flushed = true;
      }
    }
    chars.flip();
    return chars.remaining();
  }
}
