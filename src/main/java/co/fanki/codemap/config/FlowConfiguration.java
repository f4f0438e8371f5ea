package co.fanki.codemap.config;

import co.fanki.codemap.flow.domain.BranchingCaps;
import co.fanki.codemap.flow.domain.FlowReader;
import co.fanki.codemap.flow.domain.FlowWalker;
import co.fanki.codemap.flow.domain.python.PythonFlowReader;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires flow diagram generation and its branching caps.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class FlowConfiguration {

    /**
     * Creates the branching caps from configuration.
     *
     * @param functionBody statements shown under a function
     * @param classBody statements shown under a class
     * @param block statements shown under a branch, loop, try or with
     * @param handlers handlers shown under a try
     * @param handlerBody statements shown under a handler
     * @param functionParameters parameters listed in a function label
     * @param classBases bases listed in a class label
     * @param importNames names listed in an import label
     * @return the caps
     */
    @Bean
    public BranchingCaps branchingCaps(
            @Value("${codemap.flow.function-body-cap:6}") final int functionBody,
            @Value("${codemap.flow.class-body-cap:5}") final int classBody,
            @Value("${codemap.flow.block-cap:3}") final int block,
            @Value("${codemap.flow.handler-cap:2}") final int handlers,
            @Value("${codemap.flow.handler-body-cap:2}") final int handlerBody,
            @Value("${codemap.flow.function-parameter-cap:4}")
            final int functionParameters,
            @Value("${codemap.flow.class-base-cap:2}") final int classBases,
            @Value("${codemap.flow.import-name-cap:3}") final int importNames) {
        return new BranchingCaps(functionBody, classBody, block, handlers,
                handlerBody, functionParameters, classBases, importNames);
    }

    @Bean
    public FlowWalker flowWalker(final BranchingCaps caps) {
        return new FlowWalker(caps);
    }

    @Bean
    public FlowReader pythonFlowReader() {
        return new PythonFlowReader();
    }

}
