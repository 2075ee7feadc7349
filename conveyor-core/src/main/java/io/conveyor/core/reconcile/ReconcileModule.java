package io.conveyor.core.reconcile;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;

public class ReconcileModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(ManifestReconciler.class).in(Scopes.SINGLETON);
        binder.bind(ManifestReconcileExecutor.class).in(Scopes.SINGLETON);
    }
}
