package io.xmldecl.core.engine;

import io.xmldecl.core.error.HookFailureException;
import io.xmldecl.core.error.XmlProcessingException;
import io.xmldecl.core.error.XmlProcessingException.Phase;
import io.xmldecl.core.model.Hooks;
import io.xmldecl.core.model.Location;
import io.xmldecl.core.model.ProcessorState;
import io.xmldecl.core.model.ValueHook;

/**
 * Runs a processor's value hooks at the current location. Values pass through unchanged when no
 * hook is registered. Any runtime exception escaping a hook is reported as a
 * {@link HookFailureException} at the current location; engine exceptions propagate untouched so
 * they keep the location they were raised with.
 *
 * <p>Thread-safe: stateless utility class.
 */
final class HookInvoker {

    private HookInvoker() {}

    static Object afterDecode(Hooks hooks, Location location, Object value) {
        return invoke(hooks.afterDecode(), location, Phase.DECODE, value);
    }

    static Object beforeEncode(Hooks hooks, Location location, Object value) {
        return invoke(hooks.beforeEncode(), location, Phase.ENCODE, value);
    }

    private static Object invoke(ValueHook hook, Location location, Phase phase, Object value) {
        if (hook == null) {
            return value;
        }
        try {
            return hook.apply(new ProcessorState(location, phase), value);
        } catch (XmlProcessingException e) {
            throw e;
        } catch (RuntimeException e) {
            String detail = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            throw new HookFailureException(detail, e, location.toString(), phase);
        }
    }
}
