package foodweb.physics.solver;

import foodweb.config.SimulationConfig;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.ode.FirstOrderIntegrator;
import org.apache.commons.math3.ode.nonstiff.ClassicalRungeKuttaIntegrator;
import org.apache.commons.math3.ode.nonstiff.DormandPrince54Integrator;
import org.apache.commons.math3.ode.nonstiff.DormandPrince853Integrator;

/**
 * Traduce la {@link SimulationConfig} a un integrador de Commons Math.
 * <p>
 * Los integradores de Commons Math guardan estado interno (contadores, paso inicial),
 * así que se crea una instancia nueva por simulación.
 */
@Slf4j
public class OdeIntegratorFactory {

    public FirstOrderIntegrator create(SimulationConfig config) {
        if (!(config.getMaxStepSize() > 0)) {
            throw new IllegalArgumentException("maxStepSize debe ser > 0: " + config.getMaxStepSize());
        }
        if (config.getMaxEvaluations() <= 0) {
            throw new IllegalArgumentException("maxEvaluations debe ser > 0: " + config.getMaxEvaluations());
        }

        FirstOrderIntegrator integrator = switch (config.getIntegratorType()) {
            case DORMAND_PRINCE_853 -> new DormandPrince853Integrator(
                    config.getMinStepSize(), config.getMaxStepSize(),
                    config.getAbsoluteTolerance(), config.getRelativeTolerance());
            case CLASSICAL_RUNGE_KUTTA -> new ClassicalRungeKuttaIntegrator(config.getMaxStepSize());
            case DORMAND_PRINCE_54 -> new DormandPrince54Integrator(
                    config.getMinStepSize(), config.getMaxStepSize(),
                    config.getAbsoluteTolerance(), config.getRelativeTolerance());
        };
        integrator.setMaxEvaluations(config.getMaxEvaluations());

        log.debug("Integrador creado: {} (dtmax={}, maxEvals={})",
                integrator.getName(), config.getMaxStepSize(), config.getMaxEvaluations());
        return integrator;
    }
}
