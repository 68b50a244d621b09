/**
 * Tenant store and resolution strategy registrations. The options core stores them with a
 * lifetime and hands them out; looking tenants up and identifying them is left to the application.
 */
package com.tenantoptions.core.registration;
