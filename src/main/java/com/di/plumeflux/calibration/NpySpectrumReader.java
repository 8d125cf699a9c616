package com.di.plumeflux.calibration;

import com.di.plumeflux.exception.MalformedDataException;
import com.di.plumeflux.exception.TransientIoException;
import com.di.plumeflux.observer.RawFile;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads spectra saved as NumPy {@code .npy} arrays of shape {@code (2, N)}: row 0 wavelengths,
 * row 1 intensities. Format versions 1 to 3 and the numeric dtypes the spectrometer software
 * writes are supported.
 * <p>
 * A file the acquisition software still holds open is re-read up to {@code readAttempts} times
 * before the read counts as a transient failure.
 */
@Slf4j
public class NpySpectrumReader {

    private static final byte[] MAGIC = {(byte) 0x93, 'N', 'U', 'M', 'P', 'Y'};
    private static final Pattern DESCR = Pattern.compile("'descr'\\s*:\\s*'([<>|=])([a-z])(\\d+)'");
    private static final Pattern FORTRAN = Pattern.compile("'fortran_order'\\s*:\\s*(True|False)");
    private static final Pattern SHAPE = Pattern.compile("'shape'\\s*:\\s*\\(([^)]*)\\)");
    private static final long RETRY_PAUSE_MS = 200;

    private final int readAttempts;

    public NpySpectrumReader(int readAttempts) {
        this.readAttempts = Math.max(1, readAttempts);
    }

    public Spectrum read(RawFile file) {
        byte[] bytes = readBytes(file.getPath());
        return parse(file, bytes);
    }

    private byte[] readBytes(Path path) {
        IOException last = null;
        for (int attempt = 1; attempt <= readAttempts; attempt++) {
            try {
                return Files.readAllBytes(path);
            } catch (AccessDeniedException e) {
                last = e;
                log.debug("[DOAS] {} locked, attempt {}/{}", path.getFileName(), attempt, readAttempts);
                pause();
            } catch (IOException e) {
                throw new TransientIoException("Cannot read spectrum " + path, e);
            }
        }
        throw new TransientIoException("Spectrum still locked after " + readAttempts + " attempts: " + path, last);
    }

    private static void pause() {
        try {
            Thread.sleep(RETRY_PAUSE_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientIoException("Interrupted while waiting for a locked spectrum");
        }
    }

    Spectrum parse(RawFile file, byte[] bytes) {
        String name = file.fileName();
        if (bytes.length < 10 || !Arrays.equals(Arrays.copyOf(bytes, MAGIC.length), MAGIC)) {
            throw new MalformedDataException("Not an .npy file: " + name);
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        buffer.position(MAGIC.length);
        int major = buffer.get() & 0xff;
        buffer.get();
        int headerLength;
        if (major == 1) {
            headerLength = buffer.getShort() & 0xffff;
        } else if (major == 2 || major == 3) {
            headerLength = buffer.getInt();
        } else {
            throw new MalformedDataException("Unsupported .npy version " + major + " in " + name);
        }
        if (headerLength < 0 || headerLength > buffer.remaining()) {
            throw new MalformedDataException("Truncated .npy header in " + name);
        }
        byte[] headerBytes = new byte[headerLength];
        buffer.get(headerBytes);
        String header = new String(headerBytes, major == 3 ? StandardCharsets.UTF_8 : StandardCharsets.ISO_8859_1);

        Matcher descr = DESCR.matcher(header);
        Matcher fortran = FORTRAN.matcher(header);
        Matcher shape = SHAPE.matcher(header);
        if (!descr.find() || !fortran.find() || !shape.find()) {
            throw new MalformedDataException("Unreadable .npy header in " + name + ": " + header.trim());
        }
        int[] dims = Arrays.stream(shape.group(1).split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .mapToInt(Integer::parseInt)
                .toArray();
        if (dims.length != 2 || dims[0] != 2 || dims[1] < 1) {
            throw new MalformedDataException("Expected a (2, N) spectrum in " + name + ", got ("
                    + shape.group(1).trim() + ")");
        }

        char byteOrder = descr.group(1).charAt(0);
        buffer.order(byteOrder == '>' ? ByteOrder.BIG_ENDIAN : ByteOrder.LITTLE_ENDIAN);
        DType type = DType.of(descr.group(2).charAt(0), Integer.parseInt(descr.group(3)), name);
        boolean fortranOrder = "True".equals(fortran.group(1));

        int n = dims[1];
        double[] values = new double[2 * n];
        try {
            for (int i = 0; i < values.length; i++) {
                values[i] = type.next(buffer);
            }
        } catch (BufferUnderflowException e) {
            throw new MalformedDataException("Spectrum data shorter than its header declares in " + name, e);
        }

        double[] wavelengths = new double[n];
        double[] intensities = new double[n];
        for (int j = 0; j < n; j++) {
            wavelengths[j] = fortranOrder ? values[2 * j] : values[j];
            intensities[j] = fortranOrder ? values[2 * j + 1] : values[n + j];
        }
        return new Spectrum(file.getPath(), file.getAcquiredAt(), wavelengths, intensities);
    }

    private enum DType {
        F4, F8, I2, I4, I8, U2, U4;

        static DType of(char kind, int size, String name) {
            String code = ("" + kind + size).toUpperCase();
            try {
                return valueOf(code);
            } catch (IllegalArgumentException e) {
                throw new MalformedDataException("Unsupported dtype " + kind + size + " in " + name, e);
            }
        }

        double next(ByteBuffer buffer) {
            switch (this) {
                case F4:
                    return buffer.getFloat();
                case F8:
                    return buffer.getDouble();
                case I2:
                    return buffer.getShort();
                case I4:
                    return buffer.getInt();
                case I8:
                    return buffer.getLong();
                case U2:
                    return buffer.getShort() & 0xffff;
                case U4:
                    return buffer.getInt() & 0xffffffffL;
                default:
                    throw new IllegalStateException(name());
            }
        }
    }
}
