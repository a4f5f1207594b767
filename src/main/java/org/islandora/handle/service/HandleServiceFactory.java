package org.islandora.handle.service;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.Properties;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.islandora.handle.exceptions.HandleServiceFactoryException;

/**
 * HandleServiceFactory is a factory class that generates a HandleService client from the name of
 * its implementing class and its properties.
 */
public class HandleServiceFactory {
    private static final Log logHandleServiceFactory = LogFactory.getLog(HandleServiceFactory.class);

    public static final String DEFAULT_HANDLE_SERVICE =
        "org.islandora.handle.service.RestHandleService";

    /**
     * Factory method to generate a HandleService
     *
     * @param classPackage      String of the class name, ex.
     *                          "org.islandora.handle.service.RestHandleService"
     * @param serviceProperties Properties object handed to the implementation's constructor
     * @return HandleService instance ready to query, create and delete Handles
     * @throws HandleServiceFactoryException When the HandleService fails to initialize due to
     *                                       missing properties or class-related issues
     */
    public static HandleService getHandleService(String classPackage, Properties serviceProperties)
        throws HandleServiceFactoryException {
        if (classPackage == null || classPackage.trim().isEmpty()) {
            String errMsg = "HandleServiceFactory - classPackage cannot be null or empty.";
            logHandleServiceFactory.error(errMsg);
            throw new HandleServiceFactoryException(errMsg);
        }
        if (serviceProperties == null) {
            String errMsg = "HandleServiceFactory - serviceProperties cannot be null.";
            logHandleServiceFactory.error(errMsg);
            throw new HandleServiceFactoryException(errMsg);
        }

        logHandleServiceFactory.debug("Creating new 'HandleService' from package: " + classPackage);
        HandleService handleService;
        try {
            Class<?> handleServiceClass = Class.forName(classPackage);
            if (!HandleService.class.isAssignableFrom(handleServiceClass)) {
                String errMsg = "HandleServiceFactory - " + classPackage
                    + " does not implement HandleService.";
                logHandleServiceFactory.error(errMsg);
                throw new HandleServiceFactoryException(errMsg);
            }
            Constructor<?> constructor = handleServiceClass.getConstructor(Properties.class);
            handleService = (HandleService) constructor.newInstance(serviceProperties);

        } catch (ClassNotFoundException cnfe) {
            String errMsg = "HandleServiceFactory - Unable to find classPackage: " + classPackage
                + " - " + cnfe.getMessage();
            logHandleServiceFactory.error(errMsg);
            throw new HandleServiceFactoryException(errMsg);

        } catch (NoSuchMethodException nsme) {
            String errMsg = "HandleServiceFactory - Constructor taking Properties not found for: "
                + classPackage + " - " + nsme.getMessage();
            logHandleServiceFactory.error(errMsg);
            throw new HandleServiceFactoryException(errMsg);

        } catch (IllegalAccessException iae) {
            String errMsg = "HandleServiceFactory - Executing method does not have access to the"
                + " constructor of: " + classPackage + " - " + iae.getMessage();
            logHandleServiceFactory.error(errMsg);
            throw new HandleServiceFactoryException(errMsg);

        } catch (InstantiationException ie) {
            String errMsg = "HandleServiceFactory - Error instantiating: " + classPackage + " - "
                + ie.getMessage();
            logHandleServiceFactory.error(errMsg);
            throw new HandleServiceFactoryException(errMsg);

        } catch (InvocationTargetException ite) {
            String errMsg = "HandleServiceFactory - Error creating HandleService instance: "
                + ite.getCause();
            logHandleServiceFactory.error(errMsg);
            throw new HandleServiceFactoryException(errMsg);

        }
        return handleService;
    }
}
