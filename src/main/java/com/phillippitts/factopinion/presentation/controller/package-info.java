/**
 * REST controllers. Controllers are thin adapters over
 * {@link com.phillippitts.factopinion.service.orchestration.ClassificationOrchestrator}.
 */
package com.phillippitts.factopinion.presentation.controller;
