package com.questrail.harness.junit;

import com.questrail.harness.api.ServiceEndpoint;
import com.questrail.harness.process.CapturedOutput;
import com.questrail.harness.process.ManagedProcess;
import com.questrail.harness.runtime.ServiceSupervisor;
import com.questrail.harness.transport.grpc.GrpcChannels;
import io.grpc.ManagedChannel;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.ParameterContext;
import org.junit.jupiter.api.extension.ParameterResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * ServiceUnderTestExtension
 * =============================================================================
 * JUnit Jupiter extension handing a ready service to test methods.
 *
 * <h2>Parameters</h2>
 * <ul>
 *   <li>{@link ManagedProcess}: the running service</li>
 *   <li>{@link ServiceEndpoint}: its address</li>
 *   <li>{@link ManagedChannel}: a plaintext channel to it</li>
 * </ul>
 * The service is started lazily, once per test, the first time any of these
 * is resolved. Process and channel live in the test's
 * {@link ExtensionContext.Store} as {@link ExtensionContext.Store.CloseableResource}s,
 * so JUnit closes them however the test ends.
 *
 * <h2>Registration</h2>
 * <pre>{@code
 * @RegisterExtension
 * static final ServiceUnderTestExtension server =
 *         new ServiceUnderTestExtension(() -> ServiceSupervisor.builder(config).build());
 * }</pre>
 *
 * <p>When a test fails, the service output captured so far is logged at WARN.</p>
 */
public final class ServiceUnderTestExtension implements ParameterResolver, AfterEachCallback {
    private static final Logger log = LoggerFactory.getLogger(ServiceUnderTestExtension.class);

    private static final ExtensionContext.Namespace NAMESPACE =
            ExtensionContext.Namespace.create(ServiceUnderTestExtension.class);
    private static final String PROCESS_KEY = "process";
    private static final String CHANNEL_KEY = "channel";
    private static final Duration CHANNEL_CLOSE_TIMEOUT = Duration.ofSeconds(2);

    private final Supplier<ServiceSupervisor> supervisors;

    public ServiceUnderTestExtension(Supplier<ServiceSupervisor> supervisors) {
        this.supervisors = Objects.requireNonNull(supervisors, "supervisors");
    }

    @Override
    public boolean supportsParameter(ParameterContext parameterContext, ExtensionContext extensionContext) {
        Class<?> type = parameterContext.getParameter().getType();
        return type == ManagedProcess.class
                || type == ServiceEndpoint.class
                || type == ManagedChannel.class;
    }

    @Override
    public Object resolveParameter(ParameterContext parameterContext, ExtensionContext extensionContext) {
        Class<?> type = parameterContext.getParameter().getType();
        if (type == ManagedChannel.class) {
            return channel(extensionContext);
        }
        ManagedProcess process = process(extensionContext);
        return type == ServiceEndpoint.class ? process.endpoint() : process;
    }

    @Override
    public void afterEach(ExtensionContext context) {
        if (context.getExecutionException().isEmpty()) {
            return;
        }
        RunningService service = context.getStore(NAMESPACE).get(PROCESS_KEY, RunningService.class);
        if (service != null) {
            CapturedOutput output = service.process.output();
            log.warn("{} failed; {} output:\nstdout:\n{}\nstderr:\n{}",
                    context.getDisplayName(), service.process, output.stdout(), output.stderr());
        }
    }

    private ManagedProcess process(ExtensionContext context) {
        return context.getStore(NAMESPACE)
                .getOrComputeIfAbsent(PROCESS_KEY, key -> RunningService.start(supervisors.get()), RunningService.class)
                .process;
    }

    private ManagedChannel channel(ExtensionContext context) {
        ServiceEndpoint endpoint = process(context).endpoint();
        return context.getStore(NAMESPACE)
                .getOrComputeIfAbsent(CHANNEL_KEY, key -> new OpenChannel(GrpcChannels.open(endpoint)), OpenChannel.class)
                .channel;
    }

    private static final class RunningService implements ExtensionContext.Store.CloseableResource {
        private final ServiceSupervisor supervisor;
        private final ManagedProcess process;

        private RunningService(ServiceSupervisor supervisor, ManagedProcess process) {
            this.supervisor = supervisor;
            this.process = process;
        }

        static RunningService start(ServiceSupervisor supervisor) {
            try {
                return new RunningService(supervisor, supervisor.start());
            } catch (RuntimeException e) {
                supervisor.close();
                throw e;
            }
        }

        @Override
        public void close() {
            try {
                process.stop();
            } finally {
                supervisor.close();
            }
        }
    }

    private static final class OpenChannel implements ExtensionContext.Store.CloseableResource {
        private final ManagedChannel channel;

        private OpenChannel(ManagedChannel channel) {
            this.channel = channel;
        }

        @Override
        public void close() {
            GrpcChannels.close(channel, CHANNEL_CLOSE_TIMEOUT);
        }
    }
}
