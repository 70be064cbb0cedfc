package starabund.physics.i;

/**
 * Contrato base de los componentes numéricos del pipeline (optimizador, suavizado,
 * motor de ajuste). Permite identificarlos de forma uniforme en los logs.
 */
public interface ISolverComponent {
    /**
     * Nombre corto del algoritmo (ej: "Levenberg-Marquardt acotado").
     */
    String getName();

    /**
     * Descripción técnica del algoritmo.
     */
    default String getDescription() {
        return "Sin descripción disponible.";
    }

    /**
     * Nombre de un colaborador cualquiera: el suyo si es un componente, o el de su clase si no lo es
     * (ej: una lambda inyectada desde fuera).
     */
    static String nameOf(Object collaborator) {
        if (collaborator instanceof ISolverComponent) {
            return ((ISolverComponent) collaborator).getName();
        }
        return collaborator.getClass().getSimpleName();
    }
}
