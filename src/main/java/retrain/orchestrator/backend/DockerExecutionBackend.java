package retrain.orchestrator.backend;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.CreateContainerCmd;
import com.github.dockerjava.api.command.CreateContainerResponse;
import com.github.dockerjava.api.command.InspectContainerResponse;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.Bind;
import com.github.dockerjava.api.model.Container;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.Volume;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.httpclient5.ApacheDockerHttpClient;
import retrain.orchestrator.config.OrchestratorConfig;
import retrain.orchestrator.error.BackendException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs each attempt as a detached Docker container.
 * The container id is the handle. Containers are named and labelled after
 * their job and execution number, so a repeated submit finds the container
 * of an earlier one. Finished containers are removed on {@link #release}.
 */
public final class DockerExecutionBackend implements ExecutionBackend {

    private static final Logger log = LoggerFactory.getLogger(DockerExecutionBackend.class);

    private static final String MANAGED_LABEL = "retrain.managed";
    private static final String JOB_LABEL = "retrain.job-id";
    private static final String EXECUTION_LABEL = "retrain.execution";

    private final DockerClient dockerClient;
    private final String checkpointMount;

    public DockerExecutionBackend(OrchestratorConfig config) {
        DefaultDockerClientConfig clientConfig = DefaultDockerClientConfig.createDefaultConfigBuilder()
                .withDockerHost(config.dockerHost())
                .build();

        ApacheDockerHttpClient httpClient = new ApacheDockerHttpClient.Builder()
                .dockerHost(clientConfig.getDockerHost())
                .connectionTimeout(Duration.ofSeconds(30))
                .responseTimeout(config.backendTimeout())
                .build();

        this.dockerClient = DockerClientImpl.getInstance(clientConfig, httpClient);
        this.checkpointMount = config.checkpointMount();

        log.info("Docker backend connected to: {}", config.dockerHost());
    }

    @Override
    public String submit(String jobId, int executionNumber, String image, List<String> command,
            String checkpointPath) {
        try {
            Container existing = findContainer(jobId, executionNumber);
            if (existing != null) {
                if (!"created".equals(existing.getState())) {
                    log.info("Container {} for job {} execution #{} already started, reusing it",
                            shortId(existing.getId()), jobId, executionNumber);
                    return existing.getId();
                }
                // created by a submit that never got to start it
                removeContainer(existing.getId());
            }

            CreateContainerResponse container;
            try {
                container = createContainer(jobId, executionNumber, image, command, checkpointPath).exec();
            } catch (NotFoundException e) {
                pullImage(image);
                container = createContainer(jobId, executionNumber, image, command, checkpointPath).exec();
            }

            String containerId = container.getId();
            try {
                dockerClient.startContainerCmd(containerId).exec();
            } catch (RuntimeException e) {
                removeContainer(containerId);
                throw e;
            }
            log.info("Started container {} for job {} execution #{}", shortId(containerId), jobId,
                    executionNumber);
            return containerId;
        } catch (BackendException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new BackendException("Failed to start container for job " + jobId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public PollResult poll(String handle) {
        InspectContainerResponse.ContainerState state;
        try {
            state = dockerClient.inspectContainerCmd(handle).exec().getState();
        } catch (NotFoundException e) {
            return PollResult.failed("Container " + shortId(handle) + " disappeared");
        } catch (RuntimeException e) {
            throw new BackendException("Failed to inspect container " + shortId(handle) + ": " + e.getMessage(), e);
        }

        if (state == null || Boolean.TRUE.equals(state.getRunning())
                || "created".equals(state.getStatus())) {
            return PollResult.running();
        }

        Long exitCode = state.getExitCodeLong();
        if (exitCode != null && exitCode == 0) {
            return PollResult.succeeded();
        }
        if (Boolean.TRUE.equals(state.getOOMKilled())) {
            return PollResult.failed("Container was killed: out of memory");
        }
        String error = state.getError();
        return PollResult.failed(error != null && !error.isBlank()
                ? error
                : "Container exited with code " + exitCode);
    }

    @Override
    public void release(String handle) {
        removeContainer(handle);
    }

    @Override
    public String name() {
        return "docker";
    }

    @Override
    public void close() {
        try {
            dockerClient.close();
        } catch (Exception e) {
            log.warn("Error closing Docker client", e);
        }
    }

    private Container findContainer(String jobId, int executionNumber) {
        List<Container> containers = dockerClient.listContainersCmd()
                .withShowAll(true)
                .withLabelFilter(Map.of(
                        MANAGED_LABEL, "true",
                        JOB_LABEL, jobId,
                        EXECUTION_LABEL, String.valueOf(executionNumber)))
                .exec();
        return containers.isEmpty() ? null : containers.get(0);
    }

    private CreateContainerCmd createContainer(String jobId, int executionNumber, String image,
            List<String> command, String checkpointPath) {
        String checkpointDir = checkpointPath != null ? checkpointPath : checkpointMount;

        HostConfig hostConfig = HostConfig.newHostConfig().withAutoRemove(false);
        if (checkpointPath != null) {
            hostConfig.withBinds(new Bind(checkpointPath, new Volume(checkpointPath)));
        }

        CreateContainerCmd cmd = dockerClient.createContainerCmd(image)
                .withName("retrain-" + jobId + "-" + executionNumber)
                .withLabels(Map.of(
                        MANAGED_LABEL, "true",
                        JOB_LABEL, jobId,
                        EXECUTION_LABEL, String.valueOf(executionNumber)))
                .withEnv("JOB_ID=" + jobId, "CHECKPOINT_DIR=" + checkpointDir)
                .withHostConfig(hostConfig);
        if (!command.isEmpty()) {
            cmd.withCmd(command);
        }
        return cmd;
    }

    private void pullImage(String image) {
        String imageToPull = image.contains(":") ? image : image + ":latest";
        log.info("Pulling Docker image: {}", imageToPull);
        try {
            boolean done = dockerClient.pullImageCmd(imageToPull).start().awaitCompletion(5, TimeUnit.MINUTES);
            if (!done) {
                throw new BackendException("Timed out pulling image " + imageToPull);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendException("Image pull interrupted: " + imageToPull, e);
        }
    }

    private void removeContainer(String containerId) {
        try {
            dockerClient.removeContainerCmd(containerId).withForce(true).exec();
            log.debug("Container {} removed", shortId(containerId));
        } catch (Exception e) {
            log.warn("Failed to remove container {}", shortId(containerId), e);
        }
    }

    private static String shortId(String containerId) {
        return containerId.length() > 12 ? containerId.substring(0, 12) : containerId;
    }
}
