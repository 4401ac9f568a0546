package dev.scriptorium.config;

import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtLoggingLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.config.BeanFactoryPostProcessor;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.context.annotation.Configuration;

/**
 * Initializes the ONNX Runtime environment before any embedding model is loaded.
 *
 * <p>The environment is a process-wide singleton that cannot be reconfigured once created, and
 * the ONNX embedding models create it from their static initializers. Running as a {@link
 * BeanFactoryPostProcessor} places this ahead of every bean.
 *
 * <p>Intra-op threads follow the available processors; spinning is disabled since embedding runs
 * in bursts between fetches.
 */
@Configuration
public class OnnxRuntimeConfig implements BeanFactoryPostProcessor {

    private static final Logger log = LoggerFactory.getLogger(OnnxRuntimeConfig.class);

    @Override
    public void postProcessBeanFactory(ConfigurableListableBeanFactory beanFactory)
            throws BeansException {
        int intraOpThreads = Math.max(1, Runtime.getRuntime().availableProcessors());
        try (var threadingOptions = new OrtEnvironment.ThreadingOptions()) {
            threadingOptions.setGlobalSpinControl(false);
            threadingOptions.setGlobalIntraOpNumThreads(intraOpThreads);
            threadingOptions.setGlobalInterOpNumThreads(1);

            OrtEnvironment.getEnvironment(
                    OrtLoggingLevel.ORT_LOGGING_LEVEL_WARNING, "scriptorium", threadingOptions);

            log.debug("ONNX Runtime initialized: spinning=off, intra-op={}", intraOpThreads);
        } catch (OrtException e) {
            throw new IllegalStateException("Failed to configure ONNX Runtime threading", e);
        } catch (IllegalStateException e) {
            log.warn("ONNX Runtime environment already initialized, threading options not applied: {}",
                    e.getMessage());
        }
    }
}
