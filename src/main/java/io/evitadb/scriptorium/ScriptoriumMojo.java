package io.evitadb.scriptorium;

import io.evitadb.scriptorium.llm.GenerationServiceFactory;
import io.evitadb.scriptorium.llm.LlmGenerationServiceFactory;
import io.evitadb.scriptorium.model.Chunk;
import io.evitadb.scriptorium.model.ChunkStatus;
import io.evitadb.scriptorium.model.Glossary;
import io.evitadb.scriptorium.model.GlossarySelector;
import io.evitadb.scriptorium.model.Job;
import io.evitadb.scriptorium.model.JobConfig;
import io.evitadb.scriptorium.model.JobLogEntry;
import io.evitadb.scriptorium.model.JobMetrics;
import io.evitadb.scriptorium.model.JobStatus;
import io.evitadb.scriptorium.model.JobSubmission;
import io.evitadb.scriptorium.model.PipelineStep;
import io.evitadb.scriptorium.model.SubmissionReceipt;
import io.evitadb.scriptorium.model.TranslationMode;
import io.evitadb.scriptorium.stage.RetryPolicy;
import io.evitadb.scriptorium.store.FileJobStore;
import io.evitadb.scriptorium.store.GlossaryCatalog;
import io.evitadb.scriptorium.store.JobEvent;
import io.evitadb.scriptorium.store.JobEventStream;
import io.evitadb.scriptorium.store.JobJsonCodec;
import io.evitadb.scriptorium.store.PersistenceException;
import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.logging.Log;
import org.apache.maven.plugins.annotations.LifecyclePhase;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Main Mojo for Scriptorium plugin providing actions:
 * - show-config: prints current configuration
 * - translate: translates the source file and writes the target file
 * - resume: continues a job that did not complete
 * - status: prints the state of a job
 * - list: prints all stored jobs
 * - delete: removes a job
 */
@Mojo(name = "run", defaultPhase = LifecyclePhase.NONE, threadSafe = true)
public class ScriptoriumMojo extends AbstractMojo {

	private static final String SUPPORTED_ACTIONS = "show-config, translate, resume, status, list, delete";
	private static final Duration POLL_INTERVAL = Duration.ofSeconds(1);
	private static final Duration AWAIT_TIMEOUT = Duration.ofMinutes(5);

	/** Which action to perform: "show-config", "translate", "resume", "status", "list" or "delete". */
	@Parameter(property = "scriptorium.action", defaultValue = "show-config")
	private String action;

	/** LLM provider: "openai" or "anthropic". */
	@Parameter(property = "scriptorium.llmProvider", defaultValue = "openai")
	private String llmProvider = "openai";

	/** LLM URL, the provider's public endpoint when not set. */
	@Parameter(property = "scriptorium.llmUrl")
	private String llmUrl;

	/** LLM token (no default). */
	@Parameter(property = "scriptorium.llmToken")
	private String llmToken;

	/** LLM model name, the provider's default model when not set. */
	@Parameter(property = "scriptorium.llmModel")
	private String llmModel;

	/** Document to translate. */
	@Parameter(property = "scriptorium.sourceFile")
	private String sourceFile;

	/** Where to write the translation; defaults to the source file name with the target language inserted. */
	@Parameter(property = "scriptorium.targetFile")
	private String targetFile;

	/** Language of the source document. */
	@Parameter(property = "scriptorium.sourceLanguage")
	private String sourceLanguage;

	/** Language to translate to. */
	@Parameter(property = "scriptorium.targetLanguage")
	private String targetLanguage;

	/** Style or regional variant of the target language. */
	@Parameter(property = "scriptorium.accent", defaultValue = JobConfig.DEFAULT_ACCENT)
	private String accent = JobConfig.DEFAULT_ACCENT;

	/** Pipeline variant: "quick" or "deep". */
	@Parameter(property = "scriptorium.mode", defaultValue = "deep")
	private String mode = "deep";

	/** Kind of document, used as a hint in prompts. */
	@Parameter(property = "scriptorium.contentType", defaultValue = JobConfig.DEFAULT_CONTENT_TYPE)
	private String contentType = JobConfig.DEFAULT_CONTENT_TYPE;

	/** Additional instructions appended to the translation prompt. */
	@Parameter(property = "scriptorium.customInstructions")
	private String customInstructions;

	/** Maximum chunk size in characters. */
	@Parameter(property = "scriptorium.maxChunkSize", defaultValue = "2000")
	private int maxChunkSize = JobConfig.DEFAULT_MAX_CHUNK_SIZE;

	/** Number of chunks processed in parallel. */
	@Parameter(property = "scriptorium.parallelism", defaultValue = "5")
	private int parallelism = PipelineSettings.DEFAULT_PARALLELISM;

	/** Attempts per generation call, including the first one. */
	@Parameter(property = "scriptorium.maxAttempts", defaultValue = "3")
	private int maxAttempts = RetryPolicy.DEFAULT_MAX_ATTEMPTS;

	/** Wait before the first retry in milliseconds; doubles with every further retry. */
	@Parameter(property = "scriptorium.initialBackoffMillis", defaultValue = "1000")
	private long initialBackoffMillis = RetryPolicy.DEFAULT_INITIAL_BACKOFF.toMillis();

	/** Directory holding the job snapshots. */
	@Parameter(property = "scriptorium.jobStoreDir", defaultValue = "${project.build.directory}/scriptorium/jobs")
	private String jobStoreDir;

	/** JSON glossary submitted with the job, either an array of terms or an object with a "terms" array. */
	@Parameter(property = "scriptorium.glossaryFile")
	private String glossaryFile;

	/** When true, only glossary terms occurring in the document are used. */
	@Parameter(property = "scriptorium.filterGlossary", defaultValue = "true")
	private boolean filterGlossary = true;

	/** Job id for translate (optional) and for resume, status and delete (required). */
	@Parameter(property = "scriptorium.jobId")
	private String jobId;

	@Nullable
	private GenerationServiceFactory serviceFactory;

	@Override
	public void execute() throws MojoExecutionException {
		if (this.action == null || this.action.isBlank()) {
			this.action = "show-config";
		}
		switch (this.action) {
			case "show-config":
				showConfig(getLog());
				break;
			case "translate":
				translate(getLog());
				break;
			case "resume":
				resume(getLog());
				break;
			case "status":
				status(getLog());
				break;
			case "list":
				list(getLog());
				break;
			case "delete":
				delete(getLog());
				break;
			default:
				throw new MojoExecutionException("Unknown action: " + this.action + ". Supported actions: " + SUPPORTED_ACTIONS);
		}
	}

	private void showConfig(@Nonnull final Log log) {
		log.info("Scriptorium Plugin Configuration:");
		log.info(" - llmProvider: " + this.llmProvider);
		log.info(" - llmUrl: " + (isBlank(this.llmUrl) ? "<provider default>" : this.llmUrl));
		log.info(" - llmToken: " + (isBlank(this.llmToken) ? "<not set>" : mask(this.llmToken)));
		if (isBlank(this.llmToken)) {
			log.warn("LLM token is not set");
		}
		log.info(" - llmModel: " + (isBlank(this.llmModel) ? "<provider default>" : this.llmModel));
		log.info(" - sourceFile: " + orNotSet(this.sourceFile));
		log.info(" - targetFile: " + (isBlank(this.targetFile) ? "<derived from source file>" : this.targetFile));
		log.info(" - sourceLanguage: " + orNotSet(this.sourceLanguage));
		log.info(" - targetLanguage: " + orNotSet(this.targetLanguage));
		if (isBlank(this.sourceLanguage) || isBlank(this.targetLanguage)) {
			log.warn("Source and target language must be set for translate action");
		}
		log.info(" - accent: " + this.accent);
		log.info(" - mode: " + this.mode);
		log.info(" - contentType: " + this.contentType);
		log.info(" - maxChunkSize: " + this.maxChunkSize);
		log.info(" - parallelism: " + this.parallelism);
		log.info(" - maxAttempts: " + this.maxAttempts);
		log.info(" - initialBackoffMillis: " + this.initialBackoffMillis);
		log.info(" - jobStoreDir: " + orNotSet(this.jobStoreDir));
		log.info(" - glossaryFile: " + orNotSet(this.glossaryFile));
		log.info(" - filterGlossary: " + this.filterGlossary);
		log.info(" - jobId: " + orNotSet(this.jobId));
	}

	private void translate(@Nonnull final Log log) throws MojoExecutionException {
		if (isBlank(this.sourceFile)) {
			throw new MojoExecutionException("Source file must be specified for translate action");
		}
		if (isBlank(this.sourceLanguage) || isBlank(this.targetLanguage)) {
			throw new MojoExecutionException("Source and target language must be specified for translate action");
		}
		final Path source = Path.of(this.sourceFile).toAbsolutePath().normalize();
		if (!Files.isRegularFile(source)) {
			throw new MojoExecutionException("Source file does not exist: " + source);
		}
		final TranslationMode translationMode;
		try {
			translationMode = TranslationMode.fromString(isBlank(this.mode) ? "deep" : this.mode);
		} catch (IllegalArgumentException e) {
			throw new MojoExecutionException(e.getMessage(), e);
		}

		try {
			final String content = Files.readString(source, StandardCharsets.UTF_8);
			final JobConfig config = JobConfig.of(this.sourceLanguage, this.targetLanguage, translationMode)
				.withProvider(this.llmProvider, this.llmModel)
				.withAccent(this.accent)
				.withMaxChunkSize(this.maxChunkSize)
				.withContentType(this.contentType, this.customInstructions)
				.withGlossaryFiltering(this.filterGlossary);
			final GlossarySelector selector = isBlank(this.glossaryFile)
				? GlossarySelector.none()
				: GlossarySelector.inline(readGlossary(Path.of(this.glossaryFile)));
			final JobSubmission submission = new JobSubmission(
				isBlank(this.jobId) ? null : this.jobId, content, source.getFileName().toString(), config, selector
			);

			try (TranslationJobService service = createService(log)) {
				final SubmissionReceipt receipt = service.submit(submission);
				log.info("=== Translating " + source.getFileName() + " (" + this.sourceLanguage + " -> " +
					this.targetLanguage + ", " + translationMode.value() + " mode) as job " + receipt.jobId() + " ===");
				final Job job = follow(service, receipt.jobId(), log);
				final Path target = isBlank(this.targetFile)
					? Writer.defaultTarget(source, this.targetLanguage)
					: Path.of(this.targetFile).toAbsolutePath().normalize();
				new Writer().write(Optional.ofNullable(job.finalDocument()).orElse(""), target);
				log.info("Translated: " + source + " -> " + target);
			}
		} catch (IOException e) {
			throw new MojoExecutionException("Failed to execute translate action: " + e.getMessage(), e);
		} catch (PersistenceException e) {
			throw new MojoExecutionException("Job store failure: " + e.getMessage(), e);
		} catch (IllegalArgumentException e) {
			throw new MojoExecutionException(e.getMessage(), e);
		}
	}

	private void resume(@Nonnull final Log log) throws MojoExecutionException {
		final String id = requireJobId("resume");
		try (TranslationJobService service = createService(log)) {
			service.resume(id);
			final Job job = follow(service, id, log);
			log.info("Job " + id + " completed; final document has " + job.metrics().translatedWordCount() + " words");
			if (!isBlank(this.targetFile)) {
				final Path target = Path.of(this.targetFile).toAbsolutePath().normalize();
				new Writer().write(Optional.ofNullable(job.finalDocument()).orElse(""), target);
				log.info("Written: " + target);
			}
		} catch (IOException e) {
			throw new MojoExecutionException("Failed to write translation: " + e.getMessage(), e);
		} catch (PersistenceException e) {
			throw new MojoExecutionException("Job store failure: " + e.getMessage(), e);
		} catch (IllegalArgumentException e) {
			throw new MojoExecutionException(e.getMessage(), e);
		}
	}

	private void status(@Nonnull final Log log) throws MojoExecutionException {
		final String id = requireJobId("status");
		final Job job;
		try {
			job = createStore().find(id)
				.orElseThrow(() -> new MojoExecutionException("Unknown job: " + id));
		} catch (PersistenceException e) {
			throw new MojoExecutionException("Job store failure: " + e.getMessage(), e);
		}
		final JobMetrics metrics = job.metrics();
		log.info("Job " + job.jobId() + (job.originalFilename() != null ? " (" + job.originalFilename() + ")" : ""));
		log.info(" - status: " + job.status().value());
		log.info(" - step: " + job.currentStep().value());
		log.info(" - progress: " + job.progressPercent() + "%");
		log.info(" - mode: " + job.mode().value() + ", " + job.config().sourceLanguage() + " -> " + job.config().targetLanguage());
		log.info(" - glossary: " + job.glossarySource().value() +
			(job.glossary() != null ? " (" + job.glossary().size() + " terms)" : ""));
		log.info(" - chunks: " + job.chunks().size() + " total, " + countChunks(job.chunks(), true) +
			" translated, " + countChunks(job.chunks(), false) + " failed");
		log.info(" - tokens: " + metrics.totalTokens() + " in " + metrics.generationCalls() + " calls");
		if (metrics.duration() != null) {
			log.info(" - duration: " + metrics.duration().toSeconds() + " s");
		}
		if (job.errorInfo() != null) {
			log.info(" - error: " + job.errorInfo());
		}
		if (!job.logs().isEmpty()) {
			log.info("--- History (" + job.logs().size() + ") ---");
			for (final JobLogEntry entry : job.logs()) {
				log.info(entry.timestamp() + "  " + entry.level().value() + "  " +
					(entry.step() != null ? entry.step().value() : "-") + "  " + entry.message());
			}
		}
	}

	private void list(@Nonnull final Log log) throws MojoExecutionException {
		final List<Job> jobs;
		try {
			jobs = createStore().list();
		} catch (PersistenceException e) {
			throw new MojoExecutionException("Job store failure: " + e.getMessage(), e);
		}
		if (jobs.isEmpty()) {
			log.info("No jobs stored in " + this.jobStoreDir);
			return;
		}
		log.info("--- Jobs (" + jobs.size() + ") ---");
		for (final Job job : jobs) {
			log.info(job.jobId() + "  " + job.status().value() + "  " + job.currentStep().value() + "  " +
				job.progressPercent() + "%  " + job.createdAt() +
				(job.originalFilename() != null ? "  " + job.originalFilename() : ""));
		}
	}

	private void delete(@Nonnull final Log log) throws MojoExecutionException {
		final String id = requireJobId("delete");
		try {
			if (createStore().delete(id)) {
				log.info("Deleted job " + id);
			} else {
				log.info("Job " + id + " does not exist");
			}
		} catch (PersistenceException e) {
			throw new MojoExecutionException("Job store failure: " + e.getMessage(), e);
		}
	}

	/**
	 * Logs the job's progress until it ends and returns the completed snapshot.
	 */
	@Nonnull
	private Job follow(
		@Nonnull final TranslationJobService service,
		@Nonnull final String id,
		@Nonnull final Log log
	) throws PersistenceException, MojoExecutionException {
		try {
			try (JobEventStream stream = service.openStream(id)) {
				PipelineStep lastStep = null;
				int lastProgress = -1;
				while (!stream.isFinished()) {
					final Optional<JobEvent> event = stream.poll(POLL_INTERVAL);
					if (event.isEmpty() || event.get().job() == null) {
						continue;
					}
					final Job snapshot = event.get().job();
					if (snapshot.currentStep() != lastStep || snapshot.progressPercent() != lastProgress) {
						log.info("[" + id + "] " + snapshot.currentStep().value() + " " + snapshot.progressPercent() + "%");
						lastStep = snapshot.currentStep();
						lastProgress = snapshot.progressPercent();
					}
				}
			}
			final Job job = service.await(id, AWAIT_TIMEOUT)
				.orElseThrow(() -> new MojoExecutionException("Job " + id + " was deleted"));
			if (job.status() != JobStatus.COMPLETED) {
				throw new MojoExecutionException("Translation job " + id + " failed: " + job.errorInfo() +
					". Fix the cause and run the resume action with -Dscriptorium.jobId=" + id);
			}
			final JobMetrics metrics = job.metrics();
			log.info("--- Translation Summary ---");
			log.info("Chunks: " + metrics.totalChunks());
			log.info("Words: " + metrics.sourceWordCount() + " -> " + metrics.translatedWordCount());
			log.info("Input tokens: " + metrics.promptTokens());
			log.info("Output tokens: " + metrics.completionTokens());
			return job;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new MojoExecutionException("Interrupted while waiting for job " + id, e);
		} catch (TimeoutException e) {
			throw new MojoExecutionException("Job " + id + " did not finish in time", e);
		}
	}

	@Nonnull
	private TranslationJobService createService(@Nonnull final Log log) throws MojoExecutionException {
		final RetryPolicy retryPolicy = new RetryPolicy(
			this.maxAttempts,
			Duration.ofMillis(this.initialBackoffMillis),
			RetryPolicy.DEFAULT_MULTIPLIER,
			RetryPolicy.DEFAULT_MAX_BACKOFF
		);
		final PipelineSettings settings = PipelineSettings.defaults()
			.withParallelism(this.parallelism)
			.withRetryPolicy(retryPolicy);
		final GenerationServiceFactory factory = this.serviceFactory != null
			? this.serviceFactory
			: LlmGenerationServiceFactory.forProvider(this.llmProvider, this.llmUrl, this.llmToken);
		return new TranslationJobService(createStore(), new GlossaryCatalog(), factory, settings, log);
	}

	@Nonnull
	private FileJobStore createStore() throws MojoExecutionException {
		if (isBlank(this.jobStoreDir)) {
			throw new MojoExecutionException("Job store directory must be specified");
		}
		return new FileJobStore(Path.of(this.jobStoreDir), new JobJsonCodec());
	}

	@Nonnull
	private static Glossary readGlossary(@Nonnull final Path file) throws IOException {
		return new JobJsonCodec().readGlossary(Files.readString(file, StandardCharsets.UTF_8));
	}

	@Nonnull
	private String requireJobId(@Nonnull final String forAction) throws MojoExecutionException {
		if (isBlank(this.jobId)) {
			throw new MojoExecutionException("Job id must be specified for " + forAction + " action");
		}
		return this.jobId;
	}

	private static long countChunks(@Nonnull final List<Chunk> chunks, final boolean translated) {
		return chunks.stream()
			.filter(chunk -> translated ? chunk.status().hasTranslation() : chunk.status() == ChunkStatus.FAILED)
			.count();
	}

	private static boolean isBlank(@Nullable final String value) {
		return value == null || value.isBlank();
	}

	@Nonnull
	private static String orNotSet(@Nullable final String value) {
		return isBlank(value) ? "<not set>" : value;
	}

	@Nonnull
	static String mask(@Nullable final String value) {
		if (value == null || value.length() <= 4) {
			return "****";
		}
		return "****" + value.substring(value.length() - 4);
	}

	// Setters to aid testing without Maven parameter injection
	void setAction(@Nullable final String action) { this.action = action; }
	void setLlmProvider(@Nullable final String llmProvider) { this.llmProvider = llmProvider; }
	void setLlmUrl(@Nullable final String llmUrl) { this.llmUrl = llmUrl; }
	void setLlmToken(@Nullable final String llmToken) { this.llmToken = llmToken; }
	void setLlmModel(@Nullable final String llmModel) { this.llmModel = llmModel; }
	void setSourceFile(@Nullable final String sourceFile) { this.sourceFile = sourceFile; }
	void setTargetFile(@Nullable final String targetFile) { this.targetFile = targetFile; }
	void setSourceLanguage(@Nullable final String sourceLanguage) { this.sourceLanguage = sourceLanguage; }
	void setTargetLanguage(@Nullable final String targetLanguage) { this.targetLanguage = targetLanguage; }
	void setAccent(@Nullable final String accent) { this.accent = accent; }
	void setMode(@Nullable final String mode) { this.mode = mode; }
	void setContentType(@Nullable final String contentType) { this.contentType = contentType; }
	void setMaxChunkSize(final int maxChunkSize) { this.maxChunkSize = maxChunkSize; }
	void setParallelism(final int parallelism) { this.parallelism = parallelism; }
	void setMaxAttempts(final int maxAttempts) { this.maxAttempts = maxAttempts; }
	void setInitialBackoffMillis(final long initialBackoffMillis) { this.initialBackoffMillis = initialBackoffMillis; }
	void setJobStoreDir(@Nullable final String jobStoreDir) { this.jobStoreDir = jobStoreDir; }
	void setGlossaryFile(@Nullable final String glossaryFile) { this.glossaryFile = glossaryFile; }
	void setFilterGlossary(final boolean filterGlossary) { this.filterGlossary = filterGlossary; }
	void setJobId(@Nullable final String jobId) { this.jobId = jobId; }
	void setServiceFactory(@Nullable final GenerationServiceFactory serviceFactory) { this.serviceFactory = serviceFactory; }
}
