package space.maatini.magicauth.event;

/**
 * Receives access decisions of the gate.
 * <p>
 * Listeners are invoked synchronously after each decision. Exceptions are
 * logged and never change the decision.
 */
public interface AccessEventListener {

    default void onAccessGranted(AccessGrantedEvent event) {
    }

    default void onAccessDenied(AccessDeniedEvent event) {
    }
}
