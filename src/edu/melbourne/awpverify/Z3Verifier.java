/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.awpverify;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.IntExpr;
import com.microsoft.z3.IntNum;
import com.microsoft.z3.IntSort;
import com.microsoft.z3.Model;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import com.microsoft.z3.Version;
import com.microsoft.z3.Z3Exception;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.log4j.Logger;

/**
 * Z3 backed verifier. Every variable becomes a bounded integer constant, known
 * variables are fixed to their ground truth and every row of the full system
 * is asserted as an integer equality. Uniqueness is proved by asking for a
 * second model that differs from the first on some masked variable.
 *
 * Each call owns its own context and solver, so one instance can serve many
 * threads.
 *
 * @author kafle
 */
public class Z3Verifier implements SMTVerifier {

    private static final Logger logger = Logger.getLogger(Z3Verifier.class);

    private final VerifierConfig config;

    public Z3Verifier(VerifierConfig config) {
        this.config = config;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public VerifierConfig getConfig() {
        return config;
    }

    public Context getContext() {
        HashMap<String, String> cfg = new HashMap<>();
        cfg.put("model", "true");
        return new Context(cfg);
    }

    public Solver createLIASolver(Context ctx, int timeoutMillis) {
        Solver solver = ctx.mkSolver(ctx.mkSymbol("QF_LIA")); //"QF_LIA" logic for LIA
        Params p = ctx.mkParams();
        p.add("timeout", timeoutMillis); //in millisecond, expiry gives UNKNOWN
        solver.setParameters(p);
        return solver;
    }

    @Override
    public SMTResult verify(ConstraintSystem system, int timeoutMillis) {
        long start = System.currentTimeMillis();
        String outOfBounds = checkKnownBounds(system);
        if (outOfBounds != null) {
            logger.warn(outOfBounds + ", no model exists within the configured bounds");
            return SMTResult.unsat(System.currentTimeMillis() - start, outOfBounds);
        }
        try (Context ctx = getContext()) {
            Solver solver = createLIASolver(ctx, timeoutMillis);
            Map<String, IntExpr> vars = encode(ctx, solver, system);
            logger.debug("asserted " + solver.getNumAssertions() + " constraints over " + vars.size() + " variables");

            Status status = solver.check();
            if (status == Status.UNSATISFIABLE) {
                logger.error("constraint system is unsatisfiable, the scenario contradicts itself: " + system);
                return SMTResult.unsat(System.currentTimeMillis() - start);
            } else if (status == Status.UNKNOWN) {
                String reason = "solver returned unknown status: " + solver.getReasonUnknown();
                logger.warn(reason);
                return SMTResult.unknown(null, System.currentTimeMillis() - start, reason);
            }

            Map<String, Integer> witness = getWitness(solver.getModel(), vars);
            Status negation = checkUniqueness(ctx, solver, vars, system.getMaskedVariables(), witness);
            long elapsed = System.currentTimeMillis() - start;
            if (negation == Status.UNKNOWN) {
                logger.warn("uniqueness check was inconclusive for " + system);
                return SMTResult.unknown(witness, elapsed, "uniqueness check inconclusive");
            }
            return SMTResult.sat(witness, negation == Status.UNSATISFIABLE, elapsed);
        } catch (Z3Exception | IllegalArgumentException ex) {
            logger.error("Z3 error " + ex.getMessage(), ex);
            return SMTResult.error(System.currentTimeMillis() - start, ex.getMessage());
        }
    }

    /**
     * @return a description of the first known value outside [lowerBound,
     * upperBound], null when all of them fit
     */
    String checkKnownBounds(ConstraintSystem system) {
        for (Map.Entry<String, Integer> known : system.getKnownValues().entrySet()) {
            int value = known.getValue();
            if (value < config.getLowerBound() || value > config.getUpperBound()) {
                return "known value " + known.getKey() + "=" + value + " lies outside the bounds ["
                        + config.getLowerBound() + ", " + config.getUpperBound() + "]";
            }
        }
        return null;
    }

    Map<String, IntExpr> encode(Context ctx, Solver solver, ConstraintSystem system) {
        Map<String, IntExpr> vars = new LinkedHashMap<>();
        IntNum lower = ctx.mkInt(config.getLowerBound());
        IntNum upper = ctx.mkInt(config.getUpperBound());
        for (Variable v : system.getVariables()) {
            IntExpr x = ctx.mkIntConst(v.getName());
            vars.put(v.getName(), x);
            solver.add(ctx.mkGe(x, lower), ctx.mkLe(x, upper));
        }
        for (Map.Entry<String, Integer> known : system.getKnownValues().entrySet()) {
            solver.add(ctx.mkEq(vars.get(known.getKey()), ctx.mkInt(known.getValue())));
        }
        double[] rhs = system.getRhs();
        for (int i = 0; i < system.getNumRows(); i++) {
            ArithExpr<IntSort> lhs = ctx.mkInt(0);
            for (int j = 0; j < system.getNumColumns(); j++) {
                int coeff = integral(system.getCoefficient(i, j));
                if (coeff != 0) {
                    lhs = ctx.mkAdd(lhs, ctx.mkMul(ctx.mkInt(coeff), vars.get(system.getVariables().get(j).getName())));
                }
            }
            solver.add(ctx.mkEq(lhs, ctx.mkInt(integral(rhs[i]))));
        }
        return vars;
    }

    //the builder only emits -1, 0, +1 so no scaling is applied
    private static int integral(double value) {
        long r = Math.round(value);
        if (Math.abs(value - r) > 1e-9) {
            throw new IllegalArgumentException("non integral coefficient " + value);
        }
        return (int) r;
    }

    Map<String, Integer> getWitness(Model model, Map<String, IntExpr> vars) {
        Map<String, Integer> witness = new LinkedHashMap<>();
        for (Map.Entry<String, IntExpr> e : vars.entrySet()) {
            IntNum value = (IntNum) model.eval(e.getValue(), true);
            witness.put(e.getKey(), value.getInt());
        }
        return witness;
    }

    /**
     * Asks for a model where some masked variable differs from the witness.
     * The extra assertion lives in its own scope which is popped on every
     * exit, so the solver can be reused afterwards.
     *
     * @return UNSATISFIABLE when the witness is the only solution,
     * SATISFIABLE when an alternative exists, UNKNOWN when inconclusive
     */
    Status checkUniqueness(Context ctx, Solver solver, Map<String, IntExpr> vars, List<String> masked,
            Map<String, Integer> witness) {
        if (masked.isEmpty()) {
            return Status.UNSATISFIABLE;
        }
        List<BoolExpr> differs = new ArrayList<>();
        for (String name : masked) {
            differs.add(ctx.mkNot(ctx.mkEq(vars.get(name), ctx.mkInt(witness.get(name)))));
        }
        solver.push();
        try {
            solver.add(ctx.mkOr(differs.toArray(new BoolExpr[differs.size()])));
            Status status = solver.check();
            if (status == Status.SATISFIABLE) {
                logger.debug("alternative model: " + getWitness(solver.getModel(), vars));
            } else if (status == Status.UNKNOWN) {
                logger.warn("negation check returned unknown: " + solver.getReasonUnknown());
            }
            return status;
        } finally {
            solver.pop();
        }
    }

    @Override
    public String toSmtLib(ConstraintSystem system) {
        try (Context ctx = getContext()) {
            Solver solver = createLIASolver(ctx, config.getTimeoutMillis());
            encode(ctx, solver, system);
            StringBuilder sb = new StringBuilder();
            sb.append("(set-logic QF_LIA)\n");
            sb.append(solver.toString());
            sb.append("(check-sat)\n");
            sb.append("(get-model)\n");
            return sb.toString();
        }
    }

    @Override
    public Map<String, String> getVersionInfo() {
        Map<String, String> info = new LinkedHashMap<>();
        info.put("available", "true");
        info.put("backend", "z3");
        info.put("version", Version.getString());
        info.put("timeoutMillis", String.valueOf(config.getTimeoutMillis()));
        return info;
    }
}
