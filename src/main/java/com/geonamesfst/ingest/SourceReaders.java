package com.geonamesfst.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.zip.GZIPInputStream;

/**
 * 按扩展名打开 GeoNames 数据文件。
 *
 * txt 或无扩展名按纯文本读取，gz 透明解压；zip 需要先解包；bz2/xz 解码器未随本程序提供；
 * 其他扩展名记录警告后按纯文本读取。
 */
public final class SourceReaders {
    private static final Logger logger = LoggerFactory.getLogger(SourceReaders.class);

    private SourceReaders() {
    }

    public static BufferedReader open(Path path) throws IOException {
        String extension = extractExtension(path);
        switch (extension) {
            case "", "txt" -> {
                return newReader(Files.newInputStream(path));
            }
            case "gz" -> {
                InputStream raw = Files.newInputStream(path);
                try {
                    return newReader(new GZIPInputStream(raw));
                } catch (IOException exception) {
                    raw.close();
                    throw exception;
                }
            }
            case "zip" -> throw new GazetteerFormatException(
                    "不支持直接读取 GeoNames zip 包，请先解压并传入其中的 txt 文件", path.toString(), 0);
            case "bz2", "xz" -> throw new GazetteerFormatException(
                    "不支持的压缩格式 ." + extension + "，请先解压或改用 gzip", path.toString(), 0);
            default -> {
                logger.warn("未知的 GeoNames 文件扩展名 '{}'，按纯文本读取: {}（支持: txt, gz）", extension, path);
                return newReader(Files.newInputStream(path));
            }
        }
    }

    static String extractExtension(Path path) {
        String fileName = path.getFileName() == null ? "" : path.getFileName().toString();
        int lastDotIndex = fileName.lastIndexOf('.');
        if (lastDotIndex > 0 && lastDotIndex < fileName.length() - 1) {
            return fileName.substring(lastDotIndex + 1).toLowerCase(Locale.ROOT);
        }
        return "";
    }

    private static BufferedReader newReader(InputStream inputStream) {
        return new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8));
    }
}
