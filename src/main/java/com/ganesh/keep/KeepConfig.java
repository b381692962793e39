package com.ganesh.keep;

import com.ganesh.keep.crypto.Encryptor;
import com.ganesh.keep.crypto.XorEncryptor;
import com.ganesh.keep.error.ErrorSink;
import com.ganesh.keep.storage.AtomicFileWriter;
import com.ganesh.keep.storage.KeepStorage;
import com.ganesh.keep.storage.RecordFileStorage;
import com.google.common.base.Preconditions;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Holds the configuration for a {@link Keep} instance.
 * Use the nested {@link Builder} class to construct a configuration object.
 */
public class KeepConfig {
    private final String folderName;
    private final String consolidatedFileName;
    private final String externalDirectoryName;
    private final Duration saveDebounce;
    private final int headerProbeBytes;
    private final int ioThreads;
    private final Encryptor encryptor;
    private final Supplier<KeepStorage> externalStorage;
    private final ErrorSink errorSink;
    private final AtomicFileWriter fileWriter;

    private KeepConfig(Builder builder) {
        this.folderName = builder.folderName;
        this.consolidatedFileName = builder.consolidatedFileName;
        this.externalDirectoryName = builder.externalDirectoryName;
        this.saveDebounce = builder.saveDebounce;
        this.headerProbeBytes = builder.headerProbeBytes;
        this.ioThreads = builder.ioThreads;
        this.encryptor = builder.encryptor;
        this.externalStorage = builder.externalStorage;
        this.errorSink = builder.errorSink;
        this.fileWriter = builder.fileWriter;
    }

    public String getFolderName() { return folderName; }
    public String getConsolidatedFileName() { return consolidatedFileName; }
    public String getExternalDirectoryName() { return externalDirectoryName; }
    public Duration getSaveDebounce() { return saveDebounce; }
    public int getHeaderProbeBytes() { return headerProbeBytes; }
    public int getIoThreads() { return ioThreads; }
    public Encryptor getEncryptor() { return encryptor; }
    public ErrorSink getErrorSink() { return errorSink; }
    public AtomicFileWriter getFileWriter() { return fileWriter; }

    /**
     * @return A fresh instance of the engine-wide external storage backend.
     */
    public KeepStorage newExternalStorage() { return externalStorage.get(); }

    /**
     * A builder for creating immutable {@link KeepConfig} instances.
     * Provides default values for all configuration parameters.
     */
    public static class Builder {
        private String folderName = "keep";
        private String consolidatedFileName = "main.keep";
        private String externalDirectoryName = "external";
        private Duration saveDebounce = Duration.ofMillis(150);
        private int headerProbeBytes = 515; // fixed header + two 255-byte names
        private int ioThreads = 4;
        private Encryptor encryptor = XorEncryptor.withDefaultKey();
        private Supplier<KeepStorage> externalStorage = RecordFileStorage::new;
        private ErrorSink errorSink = ErrorSink.NONE;
        private AtomicFileWriter fileWriter = new AtomicFileWriter();

        /**
         * Sets the name of the folder created under the path passed to {@link Keep#init}.
         * @param folderName The folder name.
         * @return This builder instance for chaining.
         */
        public Builder withFolderName(String folderName) {
            this.folderName = folderName;
            return this;
        }

        public Builder withConsolidatedFileName(String consolidatedFileName) {
            this.consolidatedFileName = consolidatedFileName;
            return this;
        }

        public Builder withExternalDirectoryName(String externalDirectoryName) {
            this.externalDirectoryName = externalDirectoryName;
            return this;
        }

        /**
         * Sets how long the consolidated store waits for further writes before flushing to disk.
         * @param saveDebounce The debounce window; zero flushes after every write.
         * @return This builder instance for chaining.
         */
        public Builder withSaveDebounce(Duration saveDebounce) {
            this.saveDebounce = saveDebounce;
            return this;
        }

        public Builder withHeaderProbeBytes(int headerProbeBytes) {
            this.headerProbeBytes = headerProbeBytes;
            return this;
        }

        public Builder withIoThreads(int ioThreads) {
            this.ioThreads = ioThreads;
            return this;
        }

        public Builder withEncryptor(Encryptor encryptor) {
            this.encryptor = encryptor;
            return this;
        }

        /**
         * Replaces the per-record file store used by external and secure keys.
         * @param externalStorage Creates the backend; called once per engine.
         * @return This builder instance for chaining.
         */
        public Builder withExternalStorage(Supplier<KeepStorage> externalStorage) {
            this.externalStorage = externalStorage;
            return this;
        }

        public Builder withErrorSink(ErrorSink errorSink) {
            this.errorSink = errorSink;
            return this;
        }

        public Builder withFileWriter(AtomicFileWriter fileWriter) {
            this.fileWriter = fileWriter;
            return this;
        }

        /**
         * Builds the final, immutable {@link KeepConfig} object.
         * @return A new KeepConfig instance.
         */
        public KeepConfig build() {
            Preconditions.checkArgument(folderName != null && !folderName.isEmpty(), "folderName must not be empty");
            Preconditions.checkArgument(!saveDebounce.isNegative(), "saveDebounce must not be negative");
            Preconditions.checkArgument(headerProbeBytes >= 5, "headerProbeBytes must cover the fixed header");
            Preconditions.checkArgument(ioThreads > 0, "ioThreads must be positive");
            Preconditions.checkNotNull(encryptor, "encryptor");
            Preconditions.checkNotNull(externalStorage, "externalStorage");
            Preconditions.checkNotNull(errorSink, "errorSink");
            Preconditions.checkNotNull(fileWriter, "fileWriter");
            return new KeepConfig(this);
        }
    }
}
